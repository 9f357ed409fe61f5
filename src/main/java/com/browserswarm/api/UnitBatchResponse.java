package com.browserswarm.api;

import com.browserswarm.pool.UnitResult;

import java.util.List;

public record UnitBatchResponse(
        String batchId,
        List<UnitResult> results,
        String markdownTable,
        String summary,
        int workersUsed
) {
}
