package com.browserswarm.agent;

import java.util.Map;

public record ToolCall(
        String operation,
        Map<String, Object> arguments
) {
    public ToolCall {
        arguments = arguments != null ? arguments : Map.of();
    }
}
