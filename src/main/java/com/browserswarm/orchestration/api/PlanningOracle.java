package com.browserswarm.orchestration.api;

import com.browserswarm.orchestration.model.TaskPlan;

/**
 * External reasoning service that classifies an instruction into a {@link TaskPlan}.
 */
public interface PlanningOracle {

    /**
     * @throws com.browserswarm.orchestration.OracleFailureException when the service is unavailable
     *         or its answer cannot be turned into a plan
     */
    TaskPlan plan(String instruction);
}
