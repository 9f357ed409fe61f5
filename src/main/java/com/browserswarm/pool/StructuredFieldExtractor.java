package com.browserswarm.pool;

import org.springframework.lang.Nullable;

/**
 * Pulls structured research fields out of free text.
 * <p>
 * Best effort only: any field that cannot be found is reported as
 * {@link ExtractedFields#UNKNOWN}. Nothing in the dispatch path depends on the
 * extracted values being correct.
 */
public interface StructuredFieldExtractor {

    ExtractedFields extract(@Nullable String text);
}
