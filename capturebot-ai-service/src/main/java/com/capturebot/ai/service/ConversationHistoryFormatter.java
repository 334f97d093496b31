package com.capturebot.ai.service;

import com.capturebot.common.entity.ConversationMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders recent messages as prompt context, one line per message:
 * {@code role(direction): content}.
 */
public final class ConversationHistoryFormatter {

    static final String EMPTY_HISTORY = "(none)";

    private ConversationHistoryFormatter() {
    }

    /**
     * @param mostRecentFirst messages as returned by the gateway, newest first
     * @param maxContentChars per-message content limit
     * @return chronological rendering, or "(none)" when there is no history
     */
    public static String render(List<ConversationMessage> mostRecentFirst, int maxContentChars) {
        if (mostRecentFirst == null || mostRecentFirst.isEmpty()) {
            return EMPTY_HISTORY;
        }

        List<String> lines = new ArrayList<>(mostRecentFirst.size());
        for (int i = mostRecentFirst.size() - 1; i >= 0; i--) {
            ConversationMessage message = mostRecentFirst.get(i);
            String role = message.getRole() != null ? message.getRole().name().toLowerCase() : "user";
            String direction = message.getDirection() != null ? message.getDirection().name().toLowerCase() : "in";

            String content = message.getContent() != null ? message.getContent() : "";
            if (content.length() > maxContentChars) {
                content = content.substring(0, maxContentChars);
            }
            lines.add(role + "(" + direction + "): " + content.replace("\n", " "));
        }
        return String.join("\n", lines);
    }
}
