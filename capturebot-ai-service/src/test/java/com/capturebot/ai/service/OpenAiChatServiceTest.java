package com.capturebot.ai.service;

import com.capturebot.ai.service.strategy.ChatCompletionStrategy.ChatTurnResult;
import com.capturebot.ai.service.strategy.ChatCompletionStrategy.GenerationResult;
import com.capturebot.ai.service.strategy.ChatCompletionStrategy.ToolChoice;
import com.capturebot.ai.service.strategy.ChatMessage;
import com.capturebot.ai.service.strategy.ToolCall;
import com.capturebot.ai.service.strategy.ToolDefinition;
import com.capturebot.ai.support.StubExchange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OpenAiChatService request shape and response parsing.
 */
class OpenAiChatServiceTest {

    private static OpenAiChatService serviceFor(StubExchange exchange) {
        return new OpenAiChatService(exchange.webClient(), "OpenAI", "sk-test", "https://api.test/v1", "gpt-test", 5);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Response Parsing
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Plain completions return the trimmed message content")
    void complete_shouldReturnContent() {
        StubExchange exchange = StubExchange.json(
                "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"  question \"}}]}");

        GenerationResult result = serviceFor(exchange).complete("system", "user", 0.0, 5);

        assertTrue(result.isSuccessful());
        assertEquals("question", result.getText());
        assertEquals("https://api.test/v1/chat/completions", exchange.requests().get(0).url().toString());
        assertEquals("Bearer sk-test", exchange.requests().get(0).headers().getFirst("Authorization"));
    }

    @Test
    @DisplayName("Tool calls are parsed with their raw argument strings")
    void completeWithTools_shouldParseToolCalls() {
        StubExchange exchange = StubExchange.json("""
                {"choices":[{"message":{"role":"assistant","content":null,"tool_calls":[
                  {"id":"call_1","type":"function","function":{"name":"search_records","arguments":"{\\"query\\":\\"coffee\\"}"}},
                  {"id":"call_2","type":"function","function":{"name":"get_recent_records","arguments":"{}"}}
                ]}}]}
                """);

        ChatTurnResult turn = serviceFor(exchange).completeWithTools(
                List.of(ChatMessage.user("q")), List.of(), ToolChoice.AUTO, 0.2, 500);

        assertTrue(turn.isSuccessful());
        assertEquals("", turn.getText());
        assertEquals(List.of(
                new ToolCall("call_1", "search_records", "{\"query\":\"coffee\"}"),
                new ToolCall("call_2", "get_recent_records", "{}")), turn.getToolCalls());
    }

    @Test
    @DisplayName("A text-only turn has no tool calls")
    void completeWithTools_shouldReturnTextTurn() {
        StubExchange exchange = StubExchange.json("{\"choices\":[{\"message\":{\"content\":\"Done.\"}}]}");

        ChatTurnResult turn = serviceFor(exchange).completeWithTools(
                List.of(ChatMessage.user("q")), List.of(), ToolChoice.NONE, 0.2, 500);

        assertFalse(turn.hasToolCalls());
        assertEquals("Done.", turn.getText());
    }

    @Test
    @DisplayName("API errors and HTTP failures are reported as failed results")
    void complete_shouldReportFailures() {
        StubExchange apiError = StubExchange.json("{\"error\":{\"message\":\"invalid key\"}}");
        StubExchange httpError = new StubExchange(request ->
                StubExchange.response(HttpStatus.TOO_MANY_REQUESTS, "application/json", "{}"));

        GenerationResult first = serviceFor(apiError).complete("s", "u", 0.0, 5);
        ChatTurnResult second = serviceFor(httpError).completeWithTools(List.of(), List.of(), ToolChoice.AUTO, 0.2, 500);

        assertFalse(first.isSuccessful());
        assertTrue(first.getErrorMessage().contains("invalid key"));
        assertFalse(second.isSuccessful());
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Request Shape
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Transcript turns are serialized in OpenAI wire format")
    @SuppressWarnings("unchecked")
    void buildRequestBody_shouldSerializeTranscript() {
        OpenAiChatService service = serviceFor(StubExchange.json("{}"));
        ToolCall call = new ToolCall("call_1", "search_records", "{\"query\":\"x\"}");
        ToolDefinition tool = new ToolDefinition("search_records", "search", Map.of("type", "object"));

        Map<String, Object> body = service.buildRequestBody(List.of(
                ChatMessage.system("sys"),
                ChatMessage.user("q"),
                ChatMessage.assistant(null, List.of(call)),
                ChatMessage.tool("call_1", "{\"matches\":[]}")), List.of(tool), ToolChoice.NONE, 0.2, 500);

        assertEquals("gpt-test", body.get("model"));
        assertEquals(0.2, body.get("temperature"));
        assertEquals(500, body.get("max_tokens"));
        assertEquals("none", body.get("tool_choice"));

        List<Map<String, Object>> messages = (List<Map<String, Object>>) body.get("messages");
        assertEquals(4, messages.size());
        assertEquals("", messages.get(2).get("content"));
        Map<String, Object> wireCall = ((List<Map<String, Object>>) messages.get(2).get("tool_calls")).get(0);
        assertEquals("function", wireCall.get("type"));
        assertEquals("search_records", ((Map<String, Object>) wireCall.get("function")).get("name"));
        assertEquals("call_1", messages.get(3).get("tool_call_id"));
        assertFalse(messages.get(1).containsKey("tool_call_id"));

        List<Map<String, Object>> tools = (List<Map<String, Object>>) body.get("tools");
        assertEquals("search_records", ((Map<String, Object>) tools.get(0).get("function")).get("name"));
    }

    @Test
    @DisplayName("Requests without tools omit tools and tool_choice")
    void buildRequestBody_shouldOmitToolsWhenNoneGiven() {
        Map<String, Object> body = serviceFor(StubExchange.json("{}")).buildRequestBody(
                List.of(ChatMessage.user("q")), List.of(), null, 0.0, 5);

        assertFalse(body.containsKey("tools"));
        assertFalse(body.containsKey("tool_choice"));
    }
}
