package com.browserswarm.pool;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class RegexFieldExtractor implements StructuredFieldExtractor {

    private static final List<Pattern> MONEY_PATTERNS = List.of(
            Pattern.compile("\\$[\\d,]+(?:\\.\\d+)?[BMK]?(?:\\s*billion)?(?:\\s*million)?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:valued at|valuation of|worth)\\s*\\$?[\\d,]+(?:\\.\\d+)?[BMK]?\\s*(?:billion|million)?",
                    Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> SOURCE_PATTERNS = List.of(
            Pattern.compile("(?:according to|source:|from|per)\\s+([A-Za-z\\s]+?)(?:\\.|,|$)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:TechCrunch|Forbes|Bloomberg|Crunchbase|PitchBook|WSJ)", Pattern.CASE_INSENSITIVE));

    @Override
    public ExtractedFields extract(@Nullable String text) {
        if (!StringUtils.hasText(text)) {
            return ExtractedFields.unknown();
        }
        String valuation = ExtractedFields.UNKNOWN;
        String source = ExtractedFields.UNKNOWN;
        String confidence = "Low";

        for (Pattern pattern : MONEY_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                valuation = matcher.group().trim();
                confidence = "Medium";
                break;
            }
        }
        for (Pattern pattern : SOURCE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                source = stripTrailingPunctuation(matcher.group().trim());
                break;
            }
        }
        if (!ExtractedFields.UNKNOWN.equals(valuation) && !ExtractedFields.UNKNOWN.equals(source)) {
            confidence = "High";
        }
        return new ExtractedFields(valuation, source, confidence);
    }

    private String stripTrailingPunctuation(String value) {
        String result = value;
        while (!result.isEmpty() && (result.endsWith(".") || result.endsWith(","))) {
            result = result.substring(0, result.length() - 1).trim();
        }
        return result;
    }
}
