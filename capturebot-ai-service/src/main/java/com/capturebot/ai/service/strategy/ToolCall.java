package com.capturebot.ai.service.strategy;

/**
 * A tool invocation requested by the model.
 *
 * @param arguments raw JSON arguments exactly as the model produced them
 */
public record ToolCall(String id, String name, String arguments) {
}
