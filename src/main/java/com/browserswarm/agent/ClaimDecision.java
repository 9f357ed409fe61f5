package com.browserswarm.agent;

/**
 * Coordinator's answer to a claim. {@code reachable == false} means no answer was received.
 */
public record ClaimDecision(
        boolean approved,
        boolean reachable
) {
    public static ClaimDecision unreachable() {
        return new ClaimDecision(false, false);
    }
}
