package com.browserswarm.pool;

import org.springframework.lang.Nullable;

public record UnitResult(
        int workerId,
        @Nullable String label,
        UnitStatus status,
        @Nullable String rawResponse,
        @Nullable ExtractedFields fields,
        @Nullable String error,
        double durationSeconds
) {

    public static UnitResult completed(int workerId, @Nullable String label, String rawResponse,
                                       ExtractedFields fields, double durationSeconds) {
        return new UnitResult(workerId, label, UnitStatus.COMPLETED, rawResponse, fields, null, durationSeconds);
    }

    public static UnitResult failed(int workerId, @Nullable String label, String error, double durationSeconds) {
        return new UnitResult(workerId, label, UnitStatus.FAILED, null, null, error, durationSeconds);
    }

    public boolean isCompleted() {
        return status == UnitStatus.COMPLETED;
    }
}
