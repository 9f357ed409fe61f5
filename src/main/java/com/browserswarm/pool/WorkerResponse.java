package com.browserswarm.pool;

import org.springframework.lang.Nullable;

public record WorkerResponse(
        int statusCode,
        @Nullable String responseText,
        @Nullable String status
) {
    public boolean isOk() {
        return statusCode == 200;
    }
}
