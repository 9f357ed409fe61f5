package com.browserswarm.api;

public record ClaimResponse(
        boolean approved,
        String label
) {
}
