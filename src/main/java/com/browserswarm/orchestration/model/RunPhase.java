package com.browserswarm.orchestration.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunPhase {
    PLANNING, DISPATCHING, COLLECTING, SYNTHESIZING, COMPLETE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
