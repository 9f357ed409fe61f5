package com.browserswarm.orchestration.api;

import com.browserswarm.orchestration.model.AgentRunResult;
import com.browserswarm.orchestration.model.TaskPlan;

import java.util.List;

public interface SynthesisOracle {

    /**
     * Combines completed agent results into one answer. Comparative plans get a ranked answer
     * against the plan's comparison criterion.
     *
     * @throws com.browserswarm.orchestration.OracleFailureException when no answer can be produced
     */
    String synthesize(TaskPlan plan, List<AgentRunResult> results);
}
