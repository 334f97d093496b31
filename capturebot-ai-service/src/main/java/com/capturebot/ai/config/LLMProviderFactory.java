package com.capturebot.ai.config;

import com.capturebot.ai.service.MistralOcrService;
import com.capturebot.ai.service.OpenAiChatService;
import com.capturebot.ai.service.OpenAiEmbeddingsService;
import com.capturebot.ai.service.strategy.ChatCompletionStrategy;
import com.capturebot.ai.service.strategy.EmbeddingStrategy;
import com.capturebot.ai.service.strategy.TextExtractionStrategy;
import lombok.extern.slf4j.Slf4j;

/**
 * Factory for creating model provider instances.
 *
 * Static factory methods: the set of providers is fixed and each one only
 * needs a key, a base URL and a model name.
 */
@Slf4j
public class LLMProviderFactory {

    private LLMProviderFactory() {
    }

    /**
     * Create a ChatCompletionStrategy based on provider name
     *
     * @param provider Provider name: "openai" or "groq" (both speak the OpenAI wire format)
     * @throws IllegalArgumentException if provider is not supported
     */
    public static ChatCompletionStrategy createChatModel(
            String provider, String apiKey, String baseUrl, String model, long timeoutSeconds) {

        return switch (provider.toLowerCase()) {
            case "openai" -> {
                log.info("Factory: Creating OpenAI chat strategy");
                log.info("   Model: {}", model);
                yield new OpenAiChatService("OpenAI", apiKey, baseUrl, model, timeoutSeconds);
            }
            case "groq" -> {
                log.info("Factory: Creating Groq chat strategy");
                log.info("   Model: {}", model);
                yield new OpenAiChatService("Groq", apiKey, baseUrl, model, timeoutSeconds);
            }
            default -> throw new IllegalArgumentException(
                    "Unsupported chat provider: '" + provider + "'. " +
                            "Supported providers: openai, groq. " +
                            "Set 'llm.chat.provider' in application.yml.");
        };
    }

    /**
     * Create an EmbeddingStrategy based on provider name
     *
     * NOTE: Switching embedding providers requires re-embedding every stored
     * record, since the vector column has a fixed dimension.
     */
    public static EmbeddingStrategy createEmbeddingGenerator(
            String provider, String apiKey, String baseUrl, String model, long timeoutSeconds) {

        return switch (provider.toLowerCase()) {
            case "openai" -> {
                log.info("Factory: Creating OpenAI embedding strategy");
                log.info("   Model: {}", model);
                yield new OpenAiEmbeddingsService(apiKey, baseUrl, model, timeoutSeconds);
            }
            default -> throw new IllegalArgumentException(
                    "Unsupported embedding provider: '" + provider + "'. " +
                            "Supported providers: openai. " +
                            "Set 'llm.embedding.provider' in application.yml.");
        };
    }

    public static TextExtractionStrategy createTextExtractor(
            String provider, String apiKey, String baseUrl, String model, long timeoutSeconds) {

        return switch (provider.toLowerCase()) {
            case "mistral" -> {
                log.info("Factory: Creating Mistral OCR strategy");
                log.info("   Model: {}", model);
                yield new MistralOcrService(apiKey, baseUrl, model, timeoutSeconds);
            }
            default -> throw new IllegalArgumentException(
                    "Unsupported OCR provider: '" + provider + "'. " +
                            "Supported providers: mistral. " +
                            "Set 'ocr.provider' in application.yml.");
        };
    }
}
