package com.browserswarm.api;

import java.time.Instant;

public record RunAcceptedResponse(
        String runId,
        Instant acceptedAt
) {
}
