package com.capturebot.ai.config;

import com.capturebot.ai.service.MistralOcrService;
import com.capturebot.ai.service.OpenAiChatService;
import com.capturebot.ai.service.OpenAiEmbeddingsService;
import com.capturebot.ai.service.strategy.ChatCompletionStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LLMProviderFactoryTest {

    @Test
    @DisplayName("OpenAI and Groq both map to the OpenAI-compatible client")
    void createChatModel_shouldSupportOpenAiCompatibleProviders() {
        ChatCompletionStrategy openAi = LLMProviderFactory.createChatModel("openai", "k", "https://o", "gpt", 5);
        ChatCompletionStrategy groq = LLMProviderFactory.createChatModel("GROQ", "k", "https://g", "llama", 5);

        assertInstanceOf(OpenAiChatService.class, openAi);
        assertInstanceOf(OpenAiChatService.class, groq);
        assertEquals("Groq (llama)", groq.getProviderName());
    }

    @Test
    @DisplayName("Embedding and OCR providers are created by name")
    void createOtherStrategies_shouldResolveByName() {
        assertInstanceOf(OpenAiEmbeddingsService.class,
                LLMProviderFactory.createEmbeddingGenerator("openai", "k", "https://o", "emb", 5));
        assertInstanceOf(MistralOcrService.class,
                LLMProviderFactory.createTextExtractor("mistral", "k", "https://m", "pixtral", 5));
    }

    @Test
    @DisplayName("Unknown providers are rejected")
    void create_shouldRejectUnknownProviders() {
        assertThrows(IllegalArgumentException.class,
                () -> LLMProviderFactory.createChatModel("gemini", "k", "u", "m", 5));
        assertThrows(IllegalArgumentException.class,
                () -> LLMProviderFactory.createEmbeddingGenerator("cohere", "k", "u", "m", 5));
        assertThrows(IllegalArgumentException.class,
                () -> LLMProviderFactory.createTextExtractor("tesseract", "k", "u", "m", 5));
    }
}
