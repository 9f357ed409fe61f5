package com.browserswarm.pool;

public record ExtractedFields(
        String valuation,
        String source,
        String confidence
) {
    public static final String UNKNOWN = "Unknown";

    public static ExtractedFields unknown() {
        return new ExtractedFields(UNKNOWN, UNKNOWN, "Low");
    }
}
