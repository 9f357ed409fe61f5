package com.browserswarm.pool;

import org.springframework.lang.Nullable;

/**
 * One instruction destined for exactly one worker. The label may be unknown
 * when the unit is created for dynamic discovery.
 */
public record WorkUnit(
        @Nullable String label,
        String instruction
) {
}
