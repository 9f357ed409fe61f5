package com.browserswarm.api;

import com.browserswarm.orchestration.model.AgentRunResult;
import com.browserswarm.orchestration.model.RunPhase;
import com.browserswarm.orchestration.model.SwarmRunResult;
import com.browserswarm.orchestration.model.TaskPlan;

import java.time.Instant;
import java.util.List;

public record SwarmRunResponse(
        String runId,
        Instant startedAt,
        Instant finishedAt,
        TaskPlan plan,
        List<AgentRunResult> results,
        List<String> skippedUnits,
        String finalAnswer,
        RunPhase phase,
        String error
) {

    public static SwarmRunResponse from(SwarmRunResult result) {
        return new SwarmRunResponse(result.runId(), result.startedAt(), result.finishedAt(), result.plan(),
                result.results(), result.skippedUnits(), result.finalAnswer(), result.phase(), result.error());
    }
}
