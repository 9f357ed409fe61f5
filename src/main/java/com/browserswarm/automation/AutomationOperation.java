package com.browserswarm.automation;

import java.util.Map;

/**
 * One entry of the automation backend's operation catalog.
 */
public record AutomationOperation(
        String name,
        String description,
        Map<String, Object> inputSchema
) {
    public AutomationOperation {
        description = description != null ? description : "";
        inputSchema = inputSchema != null ? inputSchema : Map.of();
    }
}
