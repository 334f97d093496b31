package com.capturebot.ai.service.strategy;

import java.util.List;

/**
 * One turn of a model transcript in OpenAI chat format.
 *
 * @param toolCalls  tool calls requested by an assistant turn, empty otherwise
 * @param toolCallId id of the call a "tool" turn answers, null otherwise
 */
public record ChatMessage(String role, String content, List<ToolCall> toolCalls, String toolCallId) {

    public static ChatMessage system(String content) {
        return new ChatMessage("system", content, List.of(), null);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage("user", content, List.of(), null);
    }

    public static ChatMessage assistant(String content, List<ToolCall> toolCalls) {
        return new ChatMessage("assistant", content != null ? content : "", List.copyOf(toolCalls), null);
    }

    public static ChatMessage tool(String toolCallId, String content) {
        return new ChatMessage("tool", content, List.of(), toolCallId);
    }
}
