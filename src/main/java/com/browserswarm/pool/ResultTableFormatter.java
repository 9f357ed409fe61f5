package com.browserswarm.pool;

import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;

/**
 * Renders unit results as a markdown table for chat display.
 */
public final class ResultTableFormatter {

    private static final String HEADER = "| Target | Valuation | Source | Confidence | Status |";
    private static final String SEPARATOR = "|--------|-----------|--------|------------|--------|";

    private ResultTableFormatter() {
    }

    public static String table(List<UnitResult> results) {
        StringBuilder builder = new StringBuilder("## Research Results\n\n")
                .append(HEADER).append('\n')
                .append(SEPARATOR);
        for (UnitResult result : results) {
            ExtractedFields fields = result.fields() != null ? result.fields() : ExtractedFields.unknown();
            builder.append('\n')
                    .append("| ").append(cell(result.label())).append(" | ")
                    .append(cell(fields.valuation())).append(" | ")
                    .append(cell(fields.source())).append(" | ")
                    .append(cell(fields.confidence())).append(" | ")
                    .append(result.isCompleted() ? "✓" : "✗").append(" |");
        }
        return builder.toString();
    }

    public static String summary(List<UnitResult> results, int dispatched, double durationSeconds) {
        long completed = results.stream().filter(UnitResult::isCompleted).count();
        return String.format(Locale.ROOT,
                "*Research completed in %.1f seconds using %d parallel agents. %d/%d successful.*",
                durationSeconds, dispatched, completed, results.size());
    }

    private static String cell(String value) {
        if (!StringUtils.hasText(value)) {
            return ExtractedFields.UNKNOWN;
        }
        return value.replace("|", "\\|").replace('\n', ' ').trim();
    }
}
