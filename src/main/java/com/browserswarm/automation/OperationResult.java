package com.browserswarm.automation;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Normalized outcome of one remote operation, whatever shape the backend answered in.
 * A non-null {@code error} is the single failure signal callers need to check.
 */
public record OperationResult(
        List<String> textSegments,
        List<ImageAttachment> images,
        @Nullable String error
) {
    public OperationResult {
        textSegments = textSegments != null ? List.copyOf(textSegments) : List.of();
        images = images != null ? List.copyOf(images) : List.of();
    }

    public static OperationResult failure(String error) {
        return new OperationResult(List.of(), List.of(), error);
    }

    public boolean isError() {
        return error != null;
    }

    public String text() {
        return String.join("\n", textSegments);
    }
}
