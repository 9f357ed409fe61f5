package com.browserswarm.orchestration.service;

import com.browserswarm.orchestration.model.AgentRunResult;
import com.browserswarm.orchestration.model.TaskPlan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SwarmPromptServiceTest {

    private final SwarmPromptService service = new SwarmPromptService();

    @Test
    void testDynamicPromptListsClaimedTargets() {
        TaskPlan plan = TaskPlan.dynamicDiscovery("Find fintech startups", 3, "Find one fintech startup and its valuation");

        String empty = service.dynamicAgentPrompt(plan, List.of(), 1);
        assertTrue(empty.contains("Find one fintech startup and its valuation"));
        assertTrue(empty.contains("none yet"));

        String claimed = service.dynamicAgentPrompt(plan, List.of("stripe", "plaid"), 2);
        assertTrue(claimed.contains("stripe, plaid"));
    }

    @Test
    void testFallbackAnswerUsesLabelsOrAgentIds() {
        List<AgentRunResult> results = List.of(
                AgentRunResult.done(1, "Stripe", "$50B"),
                AgentRunResult.done(2, null, "$13B"));

        assertEquals("## Results\n\n### Stripe\n$50B\n\n### Agent 2\n$13B", service.fallbackAnswer(results));
    }

    @Test
    void testPlanningPromptCarriesAgentLimit() {
        assertTrue(service.planningSystemPrompt(4).contains("4"));
    }
}
