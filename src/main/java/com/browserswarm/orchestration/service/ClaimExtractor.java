package com.browserswarm.orchestration.service;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the {@code CLAIM: <label>} line an agent emits in its free-text answer.
 */
public final class ClaimExtractor {

    private static final Pattern CLAIM_PATTERN = Pattern.compile("CLAIM:\\s*(.+?)(?:\\n|$)", Pattern.CASE_INSENSITIVE);

    private ClaimExtractor() {
    }

    @Nullable
    public static String extract(@Nullable String text) {
        if (!StringUtils.hasText(text)) {
            return null;
        }
        Matcher matcher = CLAIM_PATTERN.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String label = matcher.group(1).replace("*", "").trim();
        return label.isEmpty() ? null : label;
    }
}
