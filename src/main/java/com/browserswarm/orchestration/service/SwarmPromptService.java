package com.browserswarm.orchestration.service;

import static com.browserswarm.orchestration.SwarmConstants.*;

import com.browserswarm.orchestration.model.AgentRunResult;
import com.browserswarm.orchestration.model.TaskPlan;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
public class SwarmPromptService {

    public String planningSystemPrompt(int maxAgents) {
        return PLANNING_SYSTEM_PROMPT.formatted(maxAgents);
    }

    /**
     * Shared template augmented with the labels already claimed, so the agent knows what to avoid.
     */
    public String dynamicAgentPrompt(TaskPlan plan, List<String> claimedLabels, int agentId) {
        String claimed = claimedLabels.isEmpty() ? NONE_CLAIMED : String.join(", ", claimedLabels);
        return DYNAMIC_AGENT_TEMPLATE.formatted(plan.sharedTemplate(), claimed, agentId, plan.targetCount());
    }

    public String resultsText(List<AgentRunResult> results) {
        return results.stream()
                .map(result -> "### " + displayLabel(result) + "\n" + result.result())
                .collect(Collectors.joining("\n\n"));
    }

    public String fallbackAnswer(List<AgentRunResult> results) {
        return RESULTS_HEADING + resultsText(results);
    }

    public String displayLabel(AgentRunResult result) {
        return result.claimedItem() != null ? result.claimedItem() : AGENT_LABEL_PREFIX + result.agentId();
    }
}
