package com.browserswarm.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Raw plan as returned by the planning model, before validation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanDraft(
        @JsonProperty("task_type") String taskType,
        @JsonProperty("target_count") Integer targetCount,
        @JsonProperty("sub_tasks") List<String> subTasks,
        @JsonProperty("base_task") String baseTask,
        @JsonProperty("comparison_criteria") String comparisonCriteria
) {
}
