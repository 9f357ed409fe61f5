package com.browserswarm.orchestration;

import com.browserswarm.orchestration.model.AgentRunResult;
import com.browserswarm.orchestration.model.RunPhase;
import com.browserswarm.orchestration.model.TaskPlan;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Mutable state of one coordination run. Agent slots are pre-sized and indexed by agent id.
 */
class SwarmRun {

    private final String runId;
    private final String instruction;
    private final Instant startedAt = Instant.now();
    private final AtomicReferenceArray<AgentRunResult> slots;
    private volatile RunPhase phase = RunPhase.PLANNING;
    @Nullable
    private volatile TaskPlan plan;

    SwarmRun(String runId, String instruction, int capacity) {
        this.runId = runId;
        this.instruction = instruction;
        this.slots = new AtomicReferenceArray<>(capacity + 1);
    }

    String runId() {
        return runId;
    }

    String instruction() {
        return instruction;
    }

    Instant startedAt() {
        return startedAt;
    }

    RunPhase phase() {
        return phase;
    }

    void phase(RunPhase phase) {
        this.phase = phase;
    }

    @Nullable
    TaskPlan plan() {
        return plan;
    }

    void plan(TaskPlan plan) {
        this.plan = plan;
    }

    boolean hasSlot(int agentId) {
        return agentId >= 1 && agentId < slots.length();
    }

    void record(AgentRunResult result) {
        if (hasSlot(result.agentId())) {
            slots.set(result.agentId(), result);
        }
    }

    void updateClaim(int agentId, String label) {
        if (hasSlot(agentId)) {
            slots.updateAndGet(agentId, current -> current != null ? current.withClaimedItem(label) : null);
        }
    }

    List<AgentRunResult> results() {
        List<AgentRunResult> results = new ArrayList<>();
        for (int i = 1; i < slots.length(); i++) {
            AgentRunResult result = slots.get(i);
            if (result != null) {
                results.add(result);
            }
        }
        return results;
    }

    List<AgentRunResult> completed() {
        return results().stream().filter(AgentRunResult::isDone).toList();
    }
}
