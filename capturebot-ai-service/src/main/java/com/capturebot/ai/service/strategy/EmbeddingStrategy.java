package com.capturebot.ai.service.strategy;

/**
 * Strategy interface for embedding generation.
 *
 * The vector column is fixed at the provider's dimension, so switching
 * providers means re-embedding every stored record.
 */
public interface EmbeddingStrategy {

    /**
     * Convert text to an embedding vector. Blank input yields an empty vector,
     * not a failure.
     */
    EmbeddingResult generateEmbedding(String text);

    String getProviderName();

    int getDimensions();

    /**
     * Result of embedding generation, success or failure
     */
    class EmbeddingResult {
        private final float[] embedding;
        private final String errorMessage;
        private final boolean successful;

        private EmbeddingResult(float[] embedding, String errorMessage, boolean successful) {
            this.embedding = embedding;
            this.errorMessage = errorMessage;
            this.successful = successful;
        }

        public static EmbeddingResult success(float[] embedding) {
            return new EmbeddingResult(embedding, null, true);
        }

        public static EmbeddingResult empty() {
            return new EmbeddingResult(new float[0], null, true);
        }

        public static EmbeddingResult failed(String errorMessage) {
            return new EmbeddingResult(null, errorMessage, false);
        }

        public float[] getEmbedding() {
            return embedding;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public boolean isSuccessful() {
            return successful;
        }

        public boolean isEmpty() {
            return embedding == null || embedding.length == 0;
        }
    }
}
