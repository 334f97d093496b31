package com.capturebot.ai.config;

import com.capturebot.ai.service.strategy.ChatCompletionStrategy;
import com.capturebot.ai.service.strategy.EmbeddingStrategy;
import com.capturebot.ai.service.strategy.TextExtractionStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the active chat, embedding and OCR providers.
 *
 * Reads 'llm.chat.provider', 'llm.embedding.provider' and 'ocr.provider',
 * resolves that provider's settings and lets LLMProviderFactory build it.
 * Switching providers is a config change plus a restart.
 */
@Slf4j
@Configuration
public class LLMProviderConfig {

    // ═══════════════════════════════════════════════════════
    // Provider Selection
    // ═══════════════════════════════════════════════════════

    @Value("${llm.chat.provider:openai}")
    private String chatProvider;

    @Value("${llm.embedding.provider:openai}")
    private String embeddingProvider;

    @Value("${ocr.provider:mistral}")
    private String ocrProvider;

    @Value("${capturebot.http.timeout-seconds:30}")
    private long timeoutSeconds;

    // ═══════════════════════════════════════════════════════
    // OpenAI Configuration
    // ═══════════════════════════════════════════════════════

    @Value("${openai.api-key:}")
    private String openAiApiKey;

    @Value("${openai.base-url:https://api.openai.com/v1}")
    private String openAiBaseUrl;

    @Value("${openai.chat-model:gpt-4o-mini}")
    private String openAiChatModel;

    @Value("${openai.embedding-model:text-embedding-3-small}")
    private String openAiEmbeddingModel;

    // ═══════════════════════════════════════════════════════
    // Groq Configuration
    // ═══════════════════════════════════════════════════════

    @Value("${groq.api-key:}")
    private String groqApiKey;

    @Value("${groq.base-url:https://api.groq.com/openai/v1}")
    private String groqBaseUrl;

    @Value("${groq.model:llama-3.3-70b-versatile}")
    private String groqModel;

    // ═══════════════════════════════════════════════════════
    // Mistral Configuration
    // ═══════════════════════════════════════════════════════

    @Value("${mistral.api-key:}")
    private String mistralApiKey;

    @Value("${mistral.base-url:https://api.mistral.ai/v1}")
    private String mistralBaseUrl;

    @Value("${mistral.model:pixtral-12b-2409}")
    private String mistralModel;

    @Bean
    public ChatCompletionStrategy chatCompletionStrategy() {
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        log.info("CONFIGURING CHAT PROVIDER");
        log.info("   Selected provider: {}", chatProvider);

        String apiKey;
        String baseUrl;
        String model;

        switch (chatProvider.toLowerCase()) {
            case "openai" -> {
                apiKey = openAiApiKey;
                baseUrl = openAiBaseUrl;
                model = openAiChatModel;
            }
            case "groq" -> {
                apiKey = groqApiKey;
                baseUrl = groqBaseUrl;
                model = groqModel;
            }
            default -> throw new IllegalArgumentException("Unknown chat provider: " + chatProvider);
        }

        ChatCompletionStrategy strategy = LLMProviderFactory.createChatModel(
                chatProvider, apiKey, baseUrl, model, timeoutSeconds);

        log.info("   API Key loaded: {}", maskKey(apiKey));
        log.info("   Active provider: {}", strategy.getProviderName());
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        return strategy;
    }

    @Bean
    public EmbeddingStrategy embeddingStrategy() {
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        log.info("CONFIGURING EMBEDDING PROVIDER");
        log.info("   Selected provider: {}", embeddingProvider);

        if (!"openai".equalsIgnoreCase(embeddingProvider)) {
            throw new IllegalArgumentException("Unknown embedding provider: " + embeddingProvider);
        }

        EmbeddingStrategy strategy = LLMProviderFactory.createEmbeddingGenerator(
                embeddingProvider, openAiApiKey, openAiBaseUrl, openAiEmbeddingModel, timeoutSeconds);

        log.info("   Active provider: {}", strategy.getProviderName());
        log.info("   Dimensions: {}", strategy.getDimensions());
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        return strategy;
    }

    @Bean
    public TextExtractionStrategy textExtractionStrategy() {
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        log.info("CONFIGURING OCR PROVIDER");
        log.info("   Selected provider: {}", ocrProvider);

        if (!"mistral".equalsIgnoreCase(ocrProvider)) {
            throw new IllegalArgumentException("Unknown OCR provider: " + ocrProvider);
        }

        TextExtractionStrategy strategy = LLMProviderFactory.createTextExtractor(
                ocrProvider, mistralApiKey, mistralBaseUrl, mistralModel, timeoutSeconds);

        log.info("   API Key loaded: {}", maskKey(mistralApiKey));
        log.info("   Active provider: {}", strategy.getProviderName());
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        return strategy;
    }

    private static String maskKey(String apiKey) {
        return apiKey != null && apiKey.length() > 4 ? apiKey.substring(0, 4) + "..." : "EMPTY OR NULL";
    }
}
