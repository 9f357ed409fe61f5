package com.browserswarm.orchestration.service;

import com.browserswarm.config.SwarmProperties;
import com.browserswarm.orchestration.OracleFailureException;
import com.browserswarm.orchestration.model.TaskMode;
import com.browserswarm.orchestration.model.TaskPlan;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;

import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChatClientPlanningOracleTest {

    private final ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
    private final ChatClientPlanningOracle oracle = new ChatClientPlanningOracle(chatClient, new SwarmPromptService(),
            new PlanDraftReader(new ObjectMapper()), new SwarmProperties());

    @SuppressWarnings("unchecked")
    private void modelAnswers(String content) {
        when(chatClient.prompt().system(anyString()).user(any(Consumer.class)).call().content()).thenReturn(content);
    }

    @Test
    void testPreAssignedPlan() {
        modelAnswers("{\"task_type\":\"pre_assigned\",\"target_count\":2,\"sub_tasks\":[\"Find Stripe's valuation\",\"Find Plaid's valuation\"]}");

        TaskPlan plan = oracle.plan("Look up Stripe and Plaid");

        assertEquals(TaskMode.PRE_ASSIGNED, plan.mode());
        assertEquals(2, plan.targetCount());
        assertEquals(List.of("Find Stripe's valuation", "Find Plaid's valuation"), plan.subInstructions());
    }

    @Test
    void testComparativePlanDefaultsCriterion() {
        modelAnswers("```json\n{\"task_type\":\"comparative\",\"target_count\":3,\"base_task\":\"Find one YC company valuation\"}\n```");

        TaskPlan plan = oracle.plan("Which YC company has the highest valuation?");

        assertEquals(TaskMode.COMPARATIVE, plan.mode());
        assertEquals("Find one YC company valuation", plan.sharedTemplate());
        assertEquals("Which YC company has the highest valuation?", plan.comparisonCriterion());
    }

    @Test
    void testUnparseableAnswerFails() {
        modelAnswers("I cannot help with that.");
        assertThrows(OracleFailureException.class, () -> oracle.plan("anything"));
    }

    @Test
    void testUnknownTaskTypeFails() {
        modelAnswers("{\"task_type\":\"sequential\",\"target_count\":2}");
        assertThrows(OracleFailureException.class, () -> oracle.plan("anything"));
    }

    @Test
    void testModelErrorFails() {
        when(chatClient.prompt()).thenThrow(new IllegalStateException("quota exceeded"));
        OracleFailureException ex = assertThrows(OracleFailureException.class, () -> oracle.plan("anything"));
        assertTrue(ex.getMessage().contains("quota exceeded"));
    }
}
