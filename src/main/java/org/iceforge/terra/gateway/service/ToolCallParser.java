package org.iceforge.terra.gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.terra.gateway.engine.ErrorCode;
import org.iceforge.terra.gateway.engine.QueryException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts tool calls from model output. Accepts a bare object, an array of objects, or
 * either one wrapped in prose or a fenced code block.
 */
@Component
public class ToolCallParser {

    private static final Pattern FENCE = Pattern.compile("(?s)```(?:json)?\\s*(.*?)```");
    private static final int MAX_RAW_IN_ERROR = 2000;

    private final ObjectMapper objectMapper;

    public ToolCallParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper);
    }

    public List<ToolCall> parse(String text) {
        if (text == null || text.isBlank()) {
            throw invalid("Model returned an empty response", text);
        }
        String body = text.trim();
        Matcher fence = FENCE.matcher(body);
        if (fence.find()) {
            body = fence.group(1).trim();
        }

        JsonNode node = read(body);
        if (node == null) {
            node = readEmbedded(body);
        }
        if (node == null) {
            throw invalid("Model did not return a valid JSON tool call", text);
        }

        List<ToolCall> calls = new ArrayList<>();
        if (node.isObject()) {
            calls.add(toCall(node, text));
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                calls.add(toCall(item, text));
            }
        }
        if (calls.isEmpty()) {
            throw invalid("Model did not return a valid JSON tool call", text);
        }
        return calls;
    }

    private JsonNode readEmbedded(String body) {
        int obj = body.indexOf('{');
        int arr = body.indexOf('[');
        JsonNode first;
        JsonNode second;
        if (arr >= 0 && (obj < 0 || arr < obj)) {
            first = read(slice(body, '[', ']'));
            second = first == null ? read(slice(body, '{', '}')) : null;
        } else {
            first = read(slice(body, '{', '}'));
            second = first == null ? read(slice(body, '[', ']')) : null;
        }
        return first != null ? first : second;
    }

    private static String slice(String body, char open, char close) {
        int start = body.indexOf(open);
        int end = body.lastIndexOf(close);
        return start >= 0 && end > start ? body.substring(start, end + 1) : null;
    }

    private JsonNode read(String candidate) {
        if (candidate == null) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && (node.isObject() || node.isArray()) ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private ToolCall toCall(JsonNode node, String raw) {
        if (!node.isObject() || !node.path("tool").isTextual() || node.path("tool").asText().isBlank()) {
            throw invalid("Tool call must be an object with a string 'tool' field", raw);
        }
        JsonNode args = node.get("args");
        if (args == null || args.isNull()) {
            return new ToolCall(node.get("tool").asText(), new LinkedHashMap<>());
        }
        if (!args.isObject()) {
            throw invalid("Tool call 'args' must be an object", raw);
        }
        Map<String, Object> map = objectMapper.convertValue(args, new TypeReference<LinkedHashMap<String, Object>>() {
        });
        return new ToolCall(node.get("tool").asText(), map);
    }

    private static QueryException invalid(String detail, String raw) {
        String shown = raw == null ? "" : raw.length() > MAX_RAW_IN_ERROR ? raw.substring(0, MAX_RAW_IN_ERROR) + "..." : raw;
        return QueryException.builder(ErrorCode.VALIDATION_ERROR, detail)
                .hint("Expected {\"tool\": \"<name>\", \"args\": {...}} or an array of such objects")
                .context("raw", shown)
                .build();
    }
}
