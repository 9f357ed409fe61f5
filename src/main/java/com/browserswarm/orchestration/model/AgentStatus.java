package com.browserswarm.orchestration.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AgentStatus {
    IDLE, WORKING, DONE, ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
