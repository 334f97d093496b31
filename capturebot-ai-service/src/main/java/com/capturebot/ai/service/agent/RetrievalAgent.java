package com.capturebot.ai.service.agent;

import com.capturebot.ai.service.ConversationHistoryFormatter;
import com.capturebot.ai.service.strategy.ChatCompletionStrategy;
import com.capturebot.ai.service.strategy.ChatCompletionStrategy.ChatTurnResult;
import com.capturebot.ai.service.strategy.ChatCompletionStrategy.ToolChoice;
import com.capturebot.ai.service.strategy.ChatMessage;
import com.capturebot.ai.service.strategy.EmbeddingStrategy;
import com.capturebot.ai.service.strategy.ToolCall;
import com.capturebot.ai.service.strategy.ToolDefinition;
import com.capturebot.common.entity.ConversationMessage;
import com.capturebot.common.exception.AnswerException;
import com.capturebot.common.service.RecordStoreGateway;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Answers a question by letting the chat model call retrieval tools over the
 * sender's records.
 *
 * The loop is bounded: at most {@code maxSteps} tool-enabled turns, then one
 * final turn with tool use disabled. That is never more than maxSteps + 1
 * completion calls per question.
 */
@Slf4j
@Service
public class RetrievalAgent {

    /**
     * Where the loop is between model turns.
     */
    enum LoopState {
        AWAITING_MODEL,
        EXECUTING_TOOLS,
        DONE
    }

    static final int HISTORY_CONTENT_LIMIT = 200;

    private static final String SYSTEM_PROMPT = """
            You are a WhatsApp capture-bot assistant.
            You have tools to search the user's saved records.
            You are also given recent conversation messages as context.
            Use tools and conversation context when needed to answer.
            Answer concisely.
            If the answer is not in the records, say you don't know and ask what to save.
            Do not mention embeddings, vectors, Supabase, or internal tooling.""";

    private final ChatCompletionStrategy chatModel;
    private final RecordStoreGateway recordStore;
    private final EmbeddingStrategy embeddings;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ToolDefinition> toolDefinitions = RetrievalTool.definitions();

    private final int maxSteps;
    private final double temperature;
    private final int maxTokens;

    public RetrievalAgent(ChatCompletionStrategy chatModel,
            RecordStoreGateway recordStore,
            EmbeddingStrategy embeddings,
            @Value("${capturebot.agent.max-steps:4}") int maxSteps,
            @Value("${capturebot.agent.temperature:0.2}") double temperature,
            @Value("${capturebot.agent.max-tokens:500}") int maxTokens) {
        this.chatModel = chatModel;
        this.recordStore = recordStore;
        this.embeddings = embeddings;
        this.maxSteps = maxSteps;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    /**
     * @param recentHistory most recent first
     * @throws AnswerException if a completion or a retrieval fails
     */
    public String answer(String senderId, String question, List<ConversationMessage> recentHistory) {
        log.info("Answering for {}: '{}'", senderId,
                question.length() > 120 ? question.substring(0, 120) + "..." : question);

        try {
            return runLoop(new ToolContext(senderId, recordStore, embeddings), question, recentHistory);
        } catch (AnswerException e) {
            throw e;
        } catch (Exception e) {
            throw new AnswerException("Failed to answer: " + e.getMessage(), e);
        }
    }

    private String runLoop(ToolContext context, String question, List<ConversationMessage> recentHistory) {
        String history = ConversationHistoryFormatter.render(recentHistory, HISTORY_CONTENT_LIMIT);

        List<ChatMessage> transcript = new ArrayList<>();
        transcript.add(ChatMessage.system(SYSTEM_PROMPT));
        transcript.add(ChatMessage.user("Recent conversation:\n" + history + "\n\nUser question:\n" + question));

        LoopState state = LoopState.AWAITING_MODEL;
        List<ToolCall> pendingCalls = List.of();
        String answer = "";
        int steps = 0;

        while (state != LoopState.DONE) {
            if (state == LoopState.AWAITING_MODEL) {
                if (steps >= maxSteps) {
                    log.info("Step budget of {} exhausted, forcing a final answer", maxSteps);
                    answer = requestTurn(transcript, ToolChoice.NONE).getText();
                    state = LoopState.DONE;
                    continue;
                }

                steps++;
                ChatTurnResult turn = requestTurn(transcript, ToolChoice.AUTO);
                if (!turn.hasToolCalls()) {
                    log.info("Answer ready after {} step(s)", steps);
                    answer = turn.getText();
                    state = LoopState.DONE;
                } else {
                    log.info("Step {}: model requested {} tool call(s)", steps, turn.getToolCalls().size());
                    transcript.add(ChatMessage.assistant(turn.getText(), turn.getToolCalls()));
                    pendingCalls = turn.getToolCalls();
                    state = LoopState.EXECUTING_TOOLS;
                }
            } else {
                for (ToolCall call : pendingCalls) {
                    Map<String, Object> result = executeTool(call, context);
                    transcript.add(ChatMessage.tool(call.id(), toJson(result)));
                }
                pendingCalls = List.of();
                state = LoopState.AWAITING_MODEL;
            }
        }
        return answer != null ? answer.trim() : "";
    }

    private ChatTurnResult requestTurn(List<ChatMessage> transcript, ToolChoice toolChoice) {
        ChatTurnResult turn = chatModel.completeWithTools(transcript, toolDefinitions, toolChoice,
                temperature, maxTokens);
        if (turn == null || !turn.isSuccessful()) {
            throw new AnswerException("Failed to answer: "
                    + (turn != null ? turn.getErrorMessage() : "no completion result"));
        }
        return turn;
    }

    Map<String, Object> executeTool(ToolCall call, ToolContext context) {
        Optional<RetrievalTool> tool = RetrievalTool.fromName(call.name());
        if (tool.isEmpty()) {
            log.warn("Model asked for unknown tool '{}'", call.name());
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", "unknown_tool");
            error.put("tool", call.name());
            return error;
        }
        log.info("Executing tool '{}'", call.name());
        return tool.get().execute(parseArguments(call.arguments()), context);
    }

    /**
     * Malformed or non-object arguments become an empty map.
     */
    Map<String, Object> parseArguments(String rawArguments) {
        if (rawArguments == null || rawArguments.isBlank()) {
            return Map.of();
        }
        try {
            JsonNode node = objectMapper.readTree(rawArguments);
            if (node == null || !node.isObject()) {
                return Map.of();
            }
            return objectMapper.convertValue(node, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed tool arguments: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private String toJson(Map<String, Object> result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new AnswerException("Failed to serialize tool result: " + e.getMessage(), e);
        }
    }
}
