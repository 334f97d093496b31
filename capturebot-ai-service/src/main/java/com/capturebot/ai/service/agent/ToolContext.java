package com.capturebot.ai.service.agent;

import com.capturebot.ai.service.strategy.EmbeddingStrategy;
import com.capturebot.common.service.RecordStoreGateway;

/**
 * What a tool needs to run: whose records to read, and how.
 */
public record ToolContext(String senderId, RecordStoreGateway recordStore, EmbeddingStrategy embeddings) {
}
