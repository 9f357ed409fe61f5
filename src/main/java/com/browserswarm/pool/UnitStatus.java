package com.browserswarm.pool;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum UnitStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
