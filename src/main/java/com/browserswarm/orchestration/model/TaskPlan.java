package com.browserswarm.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Immutable execution plan for one coordination run.
 */
public record TaskPlan(
        TaskMode mode,
        String instruction,
        int targetCount,
        List<String> subInstructions,
        String sharedTemplate,
        @Nullable String comparisonCriterion
) {
    public TaskPlan {
        subInstructions = subInstructions != null ? List.copyOf(subInstructions) : List.of();
        sharedTemplate = sharedTemplate != null ? sharedTemplate : "";
    }

    public static TaskPlan preAssigned(String instruction, List<String> subInstructions) {
        return new TaskPlan(TaskMode.PRE_ASSIGNED, instruction, subInstructions.size(), subInstructions, "", null);
    }

    public static TaskPlan dynamicDiscovery(String instruction, int targetCount, String sharedTemplate) {
        return new TaskPlan(TaskMode.DYNAMIC_DISCOVERY, instruction, targetCount, List.of(), sharedTemplate, null);
    }

    public static TaskPlan comparative(String instruction, int targetCount, String sharedTemplate, String criterion) {
        return new TaskPlan(TaskMode.COMPARATIVE, instruction, targetCount, List.of(), sharedTemplate, criterion);
    }

    /**
     * Single unit carrying the raw instruction verbatim.
     */
    public static TaskPlan fallback(String instruction) {
        return new TaskPlan(TaskMode.PRE_ASSIGNED, instruction, 1, List.of(instruction), "", null);
    }
}
