package com.browserswarm.orchestration.service;

import com.browserswarm.orchestration.model.PlanDraft;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanDraftReaderTest {

    private final PlanDraftReader reader = new PlanDraftReader(new ObjectMapper());

    @Test
    void testReadsFencedPlan() {
        String answer = """
                Sure, here is the plan:
                ```json
                {"task_type": "dynamic_discovery", "target_count": 4, "base_task": "Find a fintech startup", "extra": true}
                ```
                Let me know if you need more agents.
                """;

        PlanDraft draft = reader.read(answer);

        assertNotNull(draft);
        assertEquals("dynamic_discovery", draft.taskType());
        assertEquals(4, draft.targetCount());
        assertEquals("Find a fintech startup", draft.baseTask());
    }

    @Test
    void testReadsUnlabelledFence() {
        String answer = "```\n{\"task_type\": \"comparative\", \"target_count\": 2, \"comparison_criteria\": \"valuation\"}\n```";

        PlanDraft draft = reader.read(answer);

        assertNotNull(draft);
        assertEquals("comparative", draft.taskType());
        assertEquals("valuation", draft.comparisonCriteria());
    }

    @Test
    void testReadsObjectSurroundedByProse() {
        String answer = "The plan is {\"task_type\": \"pre_assigned\", \"sub_tasks\": [\"Research Stripe\", \"Research Plaid\"]} as requested.";

        PlanDraft draft = reader.read(answer);

        assertNotNull(draft);
        assertEquals("pre_assigned", draft.taskType());
        assertEquals(List.of("Research Stripe", "Research Plaid"), draft.subTasks());
        assertNull(draft.targetCount());
    }

    @Test
    void testEmptyAnswerGivesNothing() {
        assertNull(reader.read(""));
        assertNull(reader.read("   "));
        assertNull(reader.read(null));
    }

    @Test
    void testAnswerWithoutObjectGivesNothing() {
        assertNull(reader.read("I could not decide how to split this task."));
    }

    @Test
    void testMalformedObjectGivesNothing() {
        assertNull(reader.read("{invalid-json}"));
        assertNull(reader.read("{\"task_type\": \"dynamic_discovery\", \"target_count\": \"many\"}"));
        assertNull(reader.read("{task_type: dynamic_discovery,"));
        assertNull(reader.read("```json\n{\"task_type\": \"pre_assigned\", \"sub_tasks\": [\n```"));
    }
}
