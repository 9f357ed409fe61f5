package com.browserswarm.orchestration.service;

import com.browserswarm.orchestration.model.PlanDraft;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the planning model's answer into a {@link PlanDraft}. The model may wrap the object in a
 * code fence or surround it with prose; {@code null} means nothing usable was found.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanDraftReader {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(.*?)```", Pattern.DOTALL);
    private static final int SNIPPET_LENGTH = 240;

    private final ObjectMapper objectMapper;

    @Nullable
    public PlanDraft read(@Nullable String answer) {
        if (!StringUtils.hasText(answer)) {
            log.warn("Planning model returned an empty answer.");
            return null;
        }
        String candidate = objectCandidate(answer);
        if (candidate == null) {
            log.warn("No JSON object in planning answer: {}", snippet(answer));
            return null;
        }
        try {
            return objectMapper.readValue(candidate, PlanDraft.class);
        } catch (JsonProcessingException ex) {
            log.warn("Unparseable plan ({}): {}", ex.getOriginalMessage(), snippet(answer));
            return null;
        }
    }

    @Nullable
    private static String objectCandidate(String answer) {
        String body = answer.trim();
        Matcher fenced = FENCED.matcher(body);
        if (fenced.find()) {
            body = fenced.group(1).trim();
        }
        int open = body.indexOf('{');
        int close = body.lastIndexOf('}');
        return open >= 0 && close > open ? body.substring(open, close + 1) : null;
    }

    private static String snippet(String answer) {
        String flat = answer.replace('\r', ' ').replace('\n', ' ').trim();
        return flat.length() <= SNIPPET_LENGTH ? flat : flat.substring(0, SNIPPET_LENGTH) + "...";
    }
}
