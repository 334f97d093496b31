package com.capturebot.ai.service;

import com.capturebot.ai.service.strategy.EmbeddingStrategy;
import com.capturebot.ai.service.strategy.EmbeddingStrategy.EmbeddingResult;
import com.capturebot.common.exception.EmbeddingException;

/**
 * Turns an EmbeddingResult into a vector or an exception.
 */
public final class EmbeddingSupport {

    private EmbeddingSupport() {
    }

    /**
     * @return the embedding, or null for blank text (no provider call is made)
     * @throws EmbeddingException if the provider reports a failure
     */
    public static float[] embedOrNull(EmbeddingStrategy embeddings, String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        EmbeddingResult result = embeddings.generateEmbedding(text);
        if (result == null || !result.isSuccessful()) {
            throw new EmbeddingException(result != null ? result.getErrorMessage() : "No embedding result");
        }
        return result.isEmpty() ? null : result.getEmbedding();
    }
}
