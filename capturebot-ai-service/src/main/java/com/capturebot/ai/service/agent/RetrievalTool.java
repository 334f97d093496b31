package com.capturebot.ai.service.agent;

import com.capturebot.ai.service.EmbeddingSupport;
import com.capturebot.ai.service.strategy.ToolDefinition;
import com.capturebot.common.dto.RecordMatch;
import com.capturebot.common.entity.CapturedRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of tools the retrieval agent may call. Every tool is scoped
 * to the requesting sender's records.
 */
@Slf4j
public enum RetrievalTool {

    SEARCH_RECORDS("search_records",
            "Semantic search over the user's saved records (OCR text + notes).",
            Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "query", Map.of("type", "string"),
                            "top_k", Map.of("type", "integer", "minimum", 1, "maximum", 10, "default", 5)),
                    "required", List.of("query"))) {

        @Override
        public Map<String, Object> execute(Map<String, Object> arguments, ToolContext context) {
            Object rawQuery = arguments.get("query");
            String query = rawQuery != null ? rawQuery.toString().trim() : "";
            int topK = intArgument(arguments, "top_k");
            log.info("search_records: query='{}', top_k={}", abbreviate(query, 80), topK);

            float[] queryEmbedding = EmbeddingSupport.embedOrNull(context.embeddings(), query);
            List<RecordMatch> matches = context.recordStore().matchRecords(
                    context.senderId(), queryEmbedding != null ? queryEmbedding : new float[0], topK);

            List<Map<String, Object>> out = new ArrayList<>();
            for (RecordMatch match : matches) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("id", String.valueOf(match.recordId()));
                entry.put("record_type", typeName(match.recordType()));
                entry.put("created_at", String.valueOf(match.createdAt()));
                entry.put("similarity", match.similarity());
                entry.put("text", excerpt(match.text(), SEARCH_EXCERPT_LIMIT));
                out.add(entry);
            }
            log.info("search_records: {} match(es)", out.size());
            return Map.of("matches", out);
        }
    },

    GET_RECENT_RECORDS("get_recent_records",
            "Fetch the user's most recent saved records.",
            Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "limit", Map.of("type", "integer", "minimum", 1, "maximum", 10, "default", 5)))) {

        @Override
        public Map<String, Object> execute(Map<String, Object> arguments, ToolContext context) {
            int limit = intArgument(arguments, "limit");
            log.info("get_recent_records: limit={}", limit);

            List<Map<String, Object>> out = new ArrayList<>();
            for (CapturedRecord record : context.recordStore().getRecentRecords(context.senderId(), limit)) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("id", String.valueOf(record.getId()));
                entry.put("record_type", typeName(record.getRecordType()));
                entry.put("created_at", String.valueOf(record.getCreatedAt()));
                entry.put("text", excerpt(record.getContent(), RECENT_EXCERPT_LIMIT));
                out.add(entry);
            }
            log.info("get_recent_records: {} record(s)", out.size());
            return Map.of("records", out);
        }
    };

    static final int SEARCH_EXCERPT_LIMIT = 3000;
    static final int RECENT_EXCERPT_LIMIT = 1500;
    static final int DEFAULT_COUNT = 5;
    static final int MIN_COUNT = 1;
    static final int MAX_COUNT = 10;

    private final String toolName;
    private final String description;
    private final Map<String, Object> parameters;

    RetrievalTool(String toolName, String description, Map<String, Object> parameters) {
        this.toolName = toolName;
        this.description = description;
        this.parameters = parameters;
    }

    /**
     * Run the tool. The returned map is serialized to JSON and handed back to the model.
     */
    public abstract Map<String, Object> execute(Map<String, Object> arguments, ToolContext context);

    public String getToolName() {
        return toolName;
    }

    public ToolDefinition toDefinition() {
        return new ToolDefinition(toolName, description, parameters);
    }

    public static Optional<RetrievalTool> fromName(String name) {
        for (RetrievalTool tool : values()) {
            if (tool.toolName.equals(name)) {
                return Optional.of(tool);
            }
        }
        return Optional.empty();
    }

    public static List<ToolDefinition> definitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (RetrievalTool tool : values()) {
            definitions.add(tool.toDefinition());
        }
        return definitions;
    }

    /**
     * Read a count argument: missing or non-numeric gives the default,
     * anything outside 1..10 is clamped.
     */
    static int intArgument(Map<String, Object> arguments, String key) {
        Object raw = arguments.get(key);
        long value;
        if (raw instanceof Number number) {
            value = number.longValue();
        } else if (raw instanceof String text) {
            try {
                value = Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return DEFAULT_COUNT;
            }
        } else {
            return DEFAULT_COUNT;
        }
        return (int) Math.max(MIN_COUNT, Math.min(MAX_COUNT, value));
    }

    static String excerpt(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }

    private static String typeName(CapturedRecord.RecordType type) {
        return type != null ? type.name().toLowerCase() : null;
    }

    private static String abbreviate(String text, int maxChars) {
        return text.length() > maxChars ? text.substring(0, maxChars) + "..." : text;
    }
}
