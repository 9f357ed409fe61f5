package com.browserswarm.orchestration.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.util.Locale;

public enum TaskMode {
    /** Fixed, ordered list of instructions, one per unit. */
    PRE_ASSIGNED("pre_assigned"),
    /** One shared template; each agent picks and claims its own target. */
    DYNAMIC_DISCOVERY("dynamic_discovery"),
    /** Dynamic discovery plus a ranked synthesis against a criterion. */
    COMPARATIVE("comparative");

    private final String wireName;

    TaskMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Nullable
    public static TaskMode fromWireName(@Nullable String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (TaskMode mode : values()) {
            if (mode.wireName.equals(normalized)) {
                return mode;
            }
        }
        return null;
    }
}
