package com.capturebot.ai.service;

import com.capturebot.ai.service.strategy.ChatCompletionStrategy;
import com.capturebot.ai.service.strategy.ChatCompletionStrategy.GenerationResult;
import com.capturebot.common.entity.ConversationMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Decides whether a text message is a question or something to remember.
 *
 * Anything the model says that is not clearly "save_record", including a
 * failed call, is treated as a question.
 */
@Slf4j
@Service
public class IntentClassifier {

    public enum Intent {
        QUESTION,
        SAVE_RECORD
    }

    static final int HISTORY_CONTENT_LIMIT = 120;

    private static final String SYSTEM_PROMPT = """
            You classify user WhatsApp messages for a personal capture bot.
            You will be given the recent conversation and the latest user message.
            Return exactly one token: question OR save_record.
            - If the user asks anything, requests info, or wants to find something: question.
            - If the user is stating something to remember, logging info, or saving a note: save_record.
            """;

    private final ChatCompletionStrategy chatModel;

    public IntentClassifier(ChatCompletionStrategy chatModel) {
        this.chatModel = chatModel;
    }

    public Intent classify(String message, List<ConversationMessage> recentHistory) {
        String history = ConversationHistoryFormatter.render(recentHistory, HISTORY_CONTENT_LIMIT);
        String user = "Recent conversation:\n" + history + "\n\nLatest user message:\n" + message;

        GenerationResult result = chatModel.complete(SYSTEM_PROMPT, user, 0.0, 5);
        if (!result.isSuccessful()) {
            log.warn("Intent classification failed, treating as question: {}", result.getErrorMessage());
            return Intent.QUESTION;
        }

        String output = result.getText().toLowerCase();
        Intent intent = output.contains("save_record") ? Intent.SAVE_RECORD : Intent.QUESTION;
        log.info("Intent: {} (raw: '{}')", intent, output);
        return intent;
    }
}
