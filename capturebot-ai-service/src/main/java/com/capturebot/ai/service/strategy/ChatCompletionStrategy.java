package com.capturebot.ai.service.strategy;

import java.util.List;

/**
 * Strategy interface for chat completions, with and without tool calling.
 *
 * Providers report failures through the result objects; callers decide whether
 * a failure is fatal.
 */
public interface ChatCompletionStrategy {

    /**
     * Single system + user exchange, no tools.
     */
    GenerationResult complete(String system, String user, double temperature, int maxTokens);

    /**
     * One model turn over a full transcript with tools exposed.
     */
    ChatTurnResult completeWithTools(List<ChatMessage> transcript, List<ToolDefinition> tools,
            ToolChoice toolChoice, double temperature, int maxTokens);

    String getProviderName();

    enum ToolChoice {
        AUTO("auto"), // model decides
        NONE("none"); // model must answer in text

        private final String wireValue;

        ToolChoice(String wireValue) {
            this.wireValue = wireValue;
        }

        public String getWireValue() {
            return wireValue;
        }
    }

    class GenerationResult {
        private final String text;
        private final String errorMessage;
        private final boolean successful;

        private GenerationResult(String text, String errorMessage, boolean successful) {
            this.text = text;
            this.errorMessage = errorMessage;
            this.successful = successful;
        }

        public static GenerationResult success(String text) {
            return new GenerationResult(text != null ? text : "", null, true);
        }

        public static GenerationResult failed(String errorMessage) {
            return new GenerationResult(null, errorMessage, false);
        }

        public String getText() {
            return text;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public boolean isSuccessful() {
            return successful;
        }
    }

    /**
     * A model turn: either final text, or one or more requested tool calls.
     */
    class ChatTurnResult {
        private final String text;
        private final List<ToolCall> toolCalls;
        private final String errorMessage;
        private final boolean successful;

        private ChatTurnResult(String text, List<ToolCall> toolCalls, String errorMessage, boolean successful) {
            this.text = text;
            this.toolCalls = toolCalls;
            this.errorMessage = errorMessage;
            this.successful = successful;
        }

        public static ChatTurnResult text(String text) {
            return new ChatTurnResult(text != null ? text : "", List.of(), null, true);
        }

        public static ChatTurnResult toolCalls(String text, List<ToolCall> toolCalls) {
            return new ChatTurnResult(text != null ? text : "", List.copyOf(toolCalls), null, true);
        }

        public static ChatTurnResult failed(String errorMessage) {
            return new ChatTurnResult(null, List.of(), errorMessage, false);
        }

        public String getText() {
            return text;
        }

        public List<ToolCall> getToolCalls() {
            return toolCalls;
        }

        public boolean hasToolCalls() {
            return !toolCalls.isEmpty();
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public boolean isSuccessful() {
            return successful;
        }
    }
}
