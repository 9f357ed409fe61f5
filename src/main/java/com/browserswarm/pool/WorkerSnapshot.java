package com.browserswarm.pool;

import org.springframework.lang.Nullable;

import java.time.Instant;

public record WorkerSnapshot(
        int workerId,
        WorkerState state,
        @Nullable String assignedLabel,
        @Nullable String currentAssignment,
        @Nullable Instant lastHeartbeat,
        WorkerEndpoint endpoint
) {
}
