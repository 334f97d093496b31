package com.capturebot.ai.service;

import com.capturebot.ai.service.strategy.ChatCompletionStrategy;
import com.capturebot.ai.service.strategy.ChatMessage;
import com.capturebot.ai.service.strategy.ToolCall;
import com.capturebot.ai.service.strategy.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible Chat Completions client.
 *
 * Works against any endpoint speaking the OpenAI wire format (OpenAI, Groq),
 * including function calling. Instantiated by LLMProviderFactory, not a Spring bean.
 */
@Slf4j
public class OpenAiChatService implements ChatCompletionStrategy {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String providerLabel;
    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final Duration timeout;

    public OpenAiChatService(String providerLabel, String apiKey, String baseUrl, String model, long timeoutSeconds) {
        this(WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build(), providerLabel, apiKey, baseUrl, model, timeoutSeconds);
    }

    OpenAiChatService(WebClient webClient, String providerLabel, String apiKey, String baseUrl, String model,
            long timeoutSeconds) {
        this.webClient = webClient;
        this.objectMapper = new ObjectMapper();
        this.providerLabel = providerLabel;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.model = model;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public String getProviderName() {
        return providerLabel + " (" + model + ")";
    }

    @Override
    public GenerationResult complete(String system, String user, double temperature, int maxTokens) {
        try {
            log.debug("[{}] Completion request: system {} chars, user {} chars",
                    getProviderName(), system.length(), user.length());

            List<ChatMessage> messages = List.of(ChatMessage.system(system), ChatMessage.user(user));
            Map<String, Object> requestBody = buildRequestBody(messages, List.of(), null, temperature, maxTokens);

            Map<String, Object> message = firstChoiceMessage(post(requestBody));
            Object content = message.get("content");
            return GenerationResult.success(content != null ? content.toString().trim() : "");

        } catch (Exception e) {
            log.error("[{}] Completion failed: {}", getProviderName(), e.getMessage());
            return GenerationResult.failed("Chat completion failed: " + e.getMessage());
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public ChatTurnResult completeWithTools(List<ChatMessage> transcript, List<ToolDefinition> tools,
            ToolChoice toolChoice, double temperature, int maxTokens) {
        try {
            log.debug("[{}] Tool-enabled completion: {} turns, tool_choice={}",
                    getProviderName(), transcript.size(), toolChoice.getWireValue());

            Map<String, Object> requestBody = buildRequestBody(transcript, tools, toolChoice, temperature, maxTokens);
            Map<String, Object> message = firstChoiceMessage(post(requestBody));

            Object contentValue = message.get("content");
            String content = contentValue != null ? contentValue.toString() : "";

            List<Map<String, Object>> rawCalls = (List<Map<String, Object>>) message.get("tool_calls");
            if (rawCalls == null || rawCalls.isEmpty()) {
                return ChatTurnResult.text(content);
            }

            List<ToolCall> toolCalls = new ArrayList<>();
            for (Map<String, Object> rawCall : rawCalls) {
                Map<String, Object> function = (Map<String, Object>) rawCall.getOrDefault("function", Map.of());
                Object arguments = function.get("arguments");
                toolCalls.add(new ToolCall(
                        (String) rawCall.get("id"),
                        (String) function.get("name"),
                        arguments != null ? arguments.toString() : null));
            }
            log.info("[{}] Model requested {} tool call(s)", getProviderName(), toolCalls.size());
            return ChatTurnResult.toolCalls(content, toolCalls);

        } catch (Exception e) {
            log.error("[{}] Tool-enabled completion failed: {}", getProviderName(), e.getMessage());
            return ChatTurnResult.failed("Chat completion failed: " + e.getMessage());
        }
    }

    /**
     * Build the OpenAI request body. Tools and tool_choice are omitted when no tools are given.
     */
    Map<String, Object> buildRequestBody(List<ChatMessage> transcript, List<ToolDefinition> tools,
            ToolChoice toolChoice, double temperature, int maxTokens) {

        List<Map<String, Object>> messages = new ArrayList<>();
        for (ChatMessage turn : transcript) {
            messages.add(toWireMessage(turn));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("temperature", temperature);
        body.put("max_tokens", maxTokens);

        if (!tools.isEmpty()) {
            List<Map<String, Object>> wireTools = new ArrayList<>();
            for (ToolDefinition tool : tools) {
                wireTools.add(Map.of(
                        "type", "function",
                        "function", Map.of(
                                "name", tool.name(),
                                "description", tool.description(),
                                "parameters", tool.parameters())));
            }
            body.put("tools", wireTools);
            body.put("tool_choice", (toolChoice != null ? toolChoice : ToolChoice.AUTO).getWireValue());
        }
        return body;
    }

    private Map<String, Object> toWireMessage(ChatMessage turn) {
        // content may legitimately be null on assistant turns, so no Map.of here
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("role", turn.role());
        wire.put("content", turn.content());

        if (!turn.toolCalls().isEmpty()) {
            List<Map<String, Object>> calls = new ArrayList<>();
            for (ToolCall call : turn.toolCalls()) {
                Map<String, Object> function = new LinkedHashMap<>();
                function.put("name", call.name());
                function.put("arguments", call.arguments() != null ? call.arguments() : "{}");

                Map<String, Object> wireCall = new LinkedHashMap<>();
                wireCall.put("id", call.id());
                wireCall.put("type", "function");
                wireCall.put("function", function);
                calls.add(wireCall);
            }
            wire.put("tool_calls", calls);
        }
        if (turn.toolCallId() != null) {
            wire.put("tool_call_id", turn.toolCallId());
        }
        return wire;
    }

    private String post(Map<String, Object> requestBody) {
        return webClient
                .post()
                .uri(baseUrl + "/chat/completions")
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(String.class)
                .block(timeout);
    }

    /**
     * Navigate choices[0].message, raising on API errors or a missing message.
     */
    @SuppressWarnings("unchecked")
    private Map<String, Object> firstChoiceMessage(String response) throws Exception {
        if (response == null || response.isBlank()) {
            throw new IllegalStateException("Empty response body");
        }

        Map<String, Object> responseMap = objectMapper.readValue(response, Map.class);

        if (responseMap.containsKey("error")) {
            Object error = responseMap.get("error");
            String errorMessage = error instanceof Map ? String.valueOf(((Map<String, Object>) error).get("message"))
                    : String.valueOf(error);
            throw new IllegalStateException("API error: " + errorMessage);
        }

        List<Map<String, Object>> choices = (List<Map<String, Object>>) responseMap.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new IllegalStateException("No choices in response");
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        if (message == null) {
            throw new IllegalStateException("No message in choice");
        }

        if (responseMap.containsKey("usage")) {
            Map<String, Object> usage = (Map<String, Object>) responseMap.get("usage");
            log.debug("Token usage - Prompt: {}, Completion: {}, Total: {}",
                    usage.get("prompt_tokens"), usage.get("completion_tokens"), usage.get("total_tokens"));
        }
        return message;
    }
}
