package com.browserswarm.api;

import com.browserswarm.entity.SwarmRunLog;

import java.time.OffsetDateTime;

public record RunSummaryResponse(
        String runId,
        String instruction,
        String mode,
        int targetCount,
        int completedCount,
        int failedCount,
        int skippedCount,
        String status,
        String error,
        long durationMs,
        OffsetDateTime createdAt
) {

    public static RunSummaryResponse from(SwarmRunLog log) {
        return new RunSummaryResponse(log.getRunId(), log.getInstruction(), log.getMode(), log.getTargetCount(),
                log.getCompletedCount(), log.getFailedCount(), log.getSkippedCount(), log.getStatus(), log.getError(),
                log.getDurationMs(), log.getCreatedAt());
    }
}
