package com.browserswarm.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Finds an operation call in model output, either in a fenced json block or as an inline
 * {@code {"tool": ...}} object.
 */
@Slf4j
public class ToolCallParser {

    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";
    private static final String INLINE_MARKER = "{\"tool\"";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ToolCallParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Nullable
    public ToolCall parse(@Nullable String text) {
        if (!StringUtils.hasText(text)) {
            return null;
        }
        int fence = text.indexOf(JSON_FENCE);
        if (fence >= 0) {
            int start = fence + JSON_FENCE.length();
            int end = text.indexOf(FENCE, start);
            if (end > start) {
                ToolCall call = toToolCall(text.substring(start, end).trim());
                if (call != null) {
                    return call;
                }
            }
        }
        int inline = text.indexOf(INLINE_MARKER);
        if (inline >= 0) {
            int end = matchingBrace(text, inline);
            if (end > inline) {
                return toToolCall(text.substring(inline, end + 1));
            }
        }
        return null;
    }

    @Nullable
    private ToolCall toToolCall(String json) {
        try {
            Map<String, Object> data = objectMapper.readValue(json, MAP_TYPE);
            Object tool = data.get("tool");
            if (!(tool instanceof String name) || !StringUtils.hasText(name)) {
                return null;
            }
            Object arguments = data.get("arguments");
            Map<String, Object> args = arguments instanceof Map<?, ?> ? objectMapper.convertValue(arguments, MAP_TYPE) : Map.of();
            return new ToolCall(name, args);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("Failed to parse tool call JSON: {}", ex.getMessage());
            return null;
        }
    }

    private static int matchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
