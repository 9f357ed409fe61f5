package com.browserswarm.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Point-in-time view of the current (or last) coordination run.
 */
public record SwarmStatus(
        @Nullable String runId,
        @Nullable RunPhase phase,
        @Nullable TaskPlan plan,
        List<String> claimedItems,
        List<AgentRunResult> agents
) {
    public static SwarmStatus idle() {
        return new SwarmStatus(null, null, null, List.of(), List.of());
    }
}
