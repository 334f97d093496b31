package com.capturebot.ai.service;

import com.capturebot.ai.service.strategy.EmbeddingStrategy;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * OpenAI Embeddings implementation of EmbeddingStrategy.
 *
 * text-embedding-3-small produces 1536-dimensional vectors, matching the
 * {@code vector(1536)} column on wbot_records.
 */
@Slf4j
public class OpenAiEmbeddingsService implements EmbeddingStrategy {

    private static final int DIMENSIONS = 1536;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final Duration timeout;

    public OpenAiEmbeddingsService(String apiKey, String baseUrl, String model, long timeoutSeconds) {
        this(WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(5 * 1024 * 1024))
                .build(), apiKey, baseUrl, model, timeoutSeconds);
    }

    OpenAiEmbeddingsService(WebClient webClient, String apiKey, String baseUrl, String model, long timeoutSeconds) {
        this.webClient = webClient;
        this.objectMapper = new ObjectMapper();
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.model = model;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public String getProviderName() {
        return "OpenAI Embeddings (" + model + ")";
    }

    @Override
    public int getDimensions() {
        return DIMENSIONS;
    }

    @Override
    public EmbeddingResult generateEmbedding(String text) {
        if (text == null || text.trim().isEmpty()) {
            return EmbeddingResult.empty();
        }

        try {
            log.info("[{}] Embedding {} characters", getProviderName(), text.length());

            Map<String, Object> requestBody = Map.of(
                    "model", model,
                    "input", text);

            String response = webClient
                    .post()
                    .uri(baseUrl + "/embeddings")
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(timeout);

            return parseEmbeddingResponse(response);

        } catch (Exception e) {
            log.error("[{}] Failed to generate embedding: {}", getProviderName(), e.getMessage());
            return EmbeddingResult.failed("Embedding generation failed: " + e.getMessage());
        }
    }

    /**
     * Response shape: {"data": [{"embedding": [0.1, ...]}]}
     */
    @SuppressWarnings("unchecked")
    private EmbeddingResult parseEmbeddingResponse(String response) {
        try {
            Map<String, Object> responseMap = objectMapper.readValue(response, Map.class);

            List<Map<String, Object>> data = (List<Map<String, Object>>) responseMap.get("data");
            if (data == null || data.isEmpty()) {
                return EmbeddingResult.failed("No embedding in response");
            }

            List<Number> values = (List<Number>) data.get(0).get("embedding");
            if (values == null || values.isEmpty()) {
                return EmbeddingResult.failed("No embedding values found");
            }

            float[] vector = new float[values.size()];
            for (int i = 0; i < values.size(); i++) {
                vector[i] = values.get(i).floatValue();
            }

            log.info("[{}] Embedding generated: {} dimensions", getProviderName(), vector.length);
            return EmbeddingResult.success(vector);

        } catch (Exception e) {
            log.error("Failed to parse embedding response: {}", e.getMessage());
            return EmbeddingResult.failed("Parse error: " + e.getMessage());
        }
    }
}
