package com.browserswarm.pool;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum WorkerState {
    STARTING,
    IDLE,
    RUNNING,
    ERROR,
    STOPPING;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
