package com.capturebot.ai.support;

import com.capturebot.ai.service.strategy.EmbeddingStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic embeddings for tests: one dimension per keyword, 1 if the text
 * mentions it. Texts sharing keywords end up close together.
 */
public class KeywordEmbeddings implements EmbeddingStrategy {

    private final List<String> keywords;
    private final List<String> embeddedTexts = new ArrayList<>();

    public KeywordEmbeddings(String... keywords) {
        this.keywords = List.of(keywords);
    }

    @Override
    public EmbeddingResult generateEmbedding(String text) {
        if (text == null || text.isBlank()) {
            return EmbeddingResult.empty();
        }
        embeddedTexts.add(text);

        String lower = text.toLowerCase();
        float[] vector = new float[keywords.size() + 1];
        for (int i = 0; i < keywords.size(); i++) {
            vector[i] = lower.contains(keywords.get(i)) ? 1f : 0f;
        }
        vector[keywords.size()] = 0.01f; // keeps unrelated texts from being zero vectors
        return EmbeddingResult.success(vector);
    }

    @Override
    public String getProviderName() {
        return "keyword-test";
    }

    @Override
    public int getDimensions() {
        return keywords.size() + 1;
    }

    public List<String> embeddedTexts() {
        return embeddedTexts;
    }
}
