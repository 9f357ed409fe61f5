package com.browserswarm.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;

public record SwarmRunResult(
        String runId,
        String instruction,
        @Nullable TaskPlan plan,
        List<AgentRunResult> results,
        List<String> skippedUnits,
        String finalAnswer,
        RunPhase phase,
        @Nullable String error,
        Instant startedAt,
        Instant finishedAt
) {
    public long completedCount() {
        return results.stream().filter(AgentRunResult::isDone).count();
    }

    public long failedCount() {
        return results.size() - completedCount();
    }

    public boolean hasError() {
        return error != null;
    }
}
