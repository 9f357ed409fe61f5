package com.browserswarm.stream;

import java.time.Instant;

public record StatusEvent(
        long id,
        Instant timestamp,
        String type,
        Object payload
) {
}
