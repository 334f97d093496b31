package com.capturebot.ai.service.strategy;

import java.util.Map;

/**
 * A function the model may call, described by a JSON schema for its parameters.
 */
public record ToolDefinition(String name, String description, Map<String, Object> parameters) {
}
