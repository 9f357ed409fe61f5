package com.browserswarm.orchestration;

import static com.browserswarm.orchestration.SwarmConstants.*;

import com.browserswarm.orchestration.api.PlanningOracle;
import com.browserswarm.orchestration.api.SwarmEventListener;
import com.browserswarm.orchestration.api.SynthesisOracle;
import com.browserswarm.orchestration.model.AgentRunResult;
import com.browserswarm.orchestration.model.RunPhase;
import com.browserswarm.orchestration.model.SwarmRunResult;
import com.browserswarm.orchestration.model.SwarmStatus;
import com.browserswarm.orchestration.model.TaskMode;
import com.browserswarm.orchestration.model.TaskPlan;
import com.browserswarm.orchestration.service.ClaimExtractor;
import com.browserswarm.orchestration.service.SwarmPromptService;
import com.browserswarm.pool.UnitResult;
import com.browserswarm.pool.WorkerPool;
import com.browserswarm.pool.WorkerSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Plans an instruction into units, dispatches them to idle workers, arbitrates claims
 * and synthesizes the final answer.
 * <p>
 * A run moves through {@code planning -> dispatching -> collecting -> synthesizing -> complete}.
 * Unit failures are recorded per agent and never abort the run. The claim registry has its own
 * lock; it is never held while the pool's lock is taken.
 */
@Slf4j
public class SwarmCoordinator {

    private final WorkerPool workerPool;
    private final PlanningOracle planningOracle;
    private final SynthesisOracle synthesisOracle;
    private final SwarmPromptService promptService;
    private final ExecutorService executor;
    private final SwarmEventListener listener;
    private final int maxAgents;
    private final ClaimRegistry claimRegistry = new ClaimRegistry();

    @Nullable
    private volatile SwarmRun currentRun;

    public SwarmCoordinator(WorkerPool workerPool,
                            PlanningOracle planningOracle,
                            SynthesisOracle synthesisOracle,
                            SwarmPromptService promptService,
                            ExecutorService executor,
                            @Nullable SwarmEventListener listener,
                            int maxAgents) {
        this.workerPool = workerPool;
        this.planningOracle = planningOracle;
        this.synthesisOracle = synthesisOracle;
        this.promptService = promptService;
        this.executor = executor;
        this.listener = listener != null ? listener : SwarmEventListener.NONE;
        this.maxAgents = Math.max(1, maxAgents);
    }

    /**
     * Classifies the instruction. Falls back to a single pre-assigned unit holding the
     * instruction verbatim when the oracle fails or answers with an unusable plan.
     */
    public TaskPlan plan(String instruction) {
        try {
            TaskPlan plan = sanitize(planningOracle.plan(instruction));
            if (plan != null) {
                log.info("Planned {} run with {} agents.", plan.mode().wireName(), plan.targetCount());
                return plan;
            }
            log.warn("Planning oracle returned an unusable plan; using single-unit fallback.");
        } catch (RuntimeException ex) {
            log.warn("Planning failed ({}); using single-unit fallback.", ex.getMessage());
        }
        return TaskPlan.fallback(instruction);
    }

    public SwarmRunResult execute(String runId, String instruction) {
        SwarmRun run = new SwarmRun(runId, instruction, workerPool.size());
        claimRegistry.clear();
        currentRun = run;
        log.info("Run {} started: {}", runId, abbreviate(instruction));
        try {
            publishRunStatus(run);
            TaskPlan plan = plan(instruction);
            run.plan(plan);

            advance(run, RunPhase.DISPATCHING);
            List<String> skipped = new ArrayList<>();
            List<CompletableFuture<Void>> dispatched = dispatch(run, plan, skipped);

            advance(run, RunPhase.COLLECTING);
            CompletableFuture.allOf(dispatched.toArray(new CompletableFuture[0])).join();

            advance(run, RunPhase.SYNTHESIZING);
            String answer = synthesize(run);

            advance(run, RunPhase.COMPLETE);
            log.info("Run {} complete: {}/{} agents succeeded, {} units skipped.",
                    runId, run.completed().size(), run.results().size(), skipped.size());
            return toResult(run, skipped, answer, null);
        } catch (RuntimeException ex) {
            log.error("Run {} failed: {}", runId, ex.getMessage(), ex);
            run.phase(RunPhase.COMPLETE);
            publishRunStatus(run);
            String error = "Run failed: " + (ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
            return toResult(run, List.of(), error, error);
        }
    }

    /**
     * Reserves a target label for the agent. Exactly one of several concurrent claims for the
     * same normalized label succeeds.
     */
    public boolean claim(int agentId, String label) {
        boolean approved = claimRegistry.claim(agentId, label);
        SwarmRun run = currentRun;
        if (approved && run != null) {
            run.updateClaim(agentId, label);
        }
        emit(EVENT_CLAIM, Map.of("agentId", agentId, "label", label != null ? label : "", "approved", approved));
        if (run != null) {
            publishRunStatus(run);
        }
        return approved;
    }

    /**
     * Stores the agent's answer. A label already owned by another agent is not recorded.
     */
    public void submitResult(int agentId, String text, @Nullable String label) {
        SwarmRun run = currentRun;
        if (run == null) {
            log.warn("Result from agent {} arrived with no active run.", agentId);
            return;
        }
        submitResult(run, agentId, text, label);
    }

    public void submitError(int agentId, String error) {
        SwarmRun run = currentRun;
        if (run == null) {
            log.warn("Error from agent {} arrived with no active run.", agentId);
            return;
        }
        submitError(run, agentId, error);
    }

    public SwarmStatus status() {
        SwarmRun run = currentRun;
        if (run == null) {
            return SwarmStatus.idle();
        }
        return new SwarmStatus(run.runId(), run.phase(), run.plan(), claimRegistry.labels(), run.results());
    }

    private List<CompletableFuture<Void>> dispatch(SwarmRun run, TaskPlan plan, List<String> skipped) {
        List<WorkerSnapshot> workers = workerPool.acquireIdle(plan.targetCount());
        if (workers.size() < plan.targetCount()) {
            log.warn("Run {}: {} agents planned but only {} idle workers.", run.runId(), plan.targetCount(), workers.size());
        }
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < plan.targetCount(); i++) {
            if (plan.mode() == TaskMode.PRE_ASSIGNED && i >= plan.subInstructions().size()) {
                break;
            }
            if (i >= workers.size()) {
                skipped.add(plan.mode() == TaskMode.PRE_ASSIGNED
                        ? plan.subInstructions().get(i)
                        : AGENT_LABEL_PREFIX + (i + 1));
                continue;
            }
            int agentId = workers.get(i).workerId();
            String label;
            String instruction;
            if (plan.mode() == TaskMode.PRE_ASSIGNED) {
                label = plan.subInstructions().get(i);
                instruction = label;
            } else {
                label = AGENT_LABEL_PREFIX + agentId;
                instruction = promptService.dynamicAgentPrompt(plan, claimRegistry.labels(), agentId);
            }
            run.record(AgentRunResult.working(agentId, null));
            futures.add(CompletableFuture.runAsync(() -> runAgent(run, agentId, label, instruction), executor));
        }
        publishRunStatus(run);
        return futures;
    }

    private void runAgent(SwarmRun run, int agentId, String label, String instruction) {
        try {
            UnitResult unit = workerPool.assign(agentId, label, instruction);
            if (unit.isCompleted()) {
                String text = unit.rawResponse() != null ? unit.rawResponse() : "";
                submitResult(run, agentId, text, ClaimExtractor.extract(text));
            } else {
                submitError(run, agentId, unit.error() != null ? unit.error() : "Unknown failure");
            }
        } catch (RuntimeException ex) {
            submitError(run, agentId, ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        }
    }

    private void submitResult(SwarmRun run, int agentId, String text, @Nullable String label) {
        String claimed = label;
        if (claimed != null && !claimRegistry.confirm(agentId, claimed)) {
            log.warn("Agent {} reported '{}' but it is claimed by agent {}; not recorded.",
                    agentId, claimed, claimRegistry.ownerOf(claimed));
            claimed = null;
        }
        AgentRunResult result = AgentRunResult.done(agentId, claimed, text);
        run.record(result);
        log.info("Agent {} submitted result for '{}'.", agentId, claimed);
        emit(EVENT_AGENT_RESULT, result);
        publishRunStatus(run);
    }

    private void submitError(SwarmRun run, int agentId, String error) {
        AgentRunResult result = AgentRunResult.error(agentId, error);
        run.record(result);
        log.error("Agent {} reported error: {}", agentId, error);
        emit(EVENT_AGENT_RESULT, result);
        publishRunStatus(run);
    }

    private String synthesize(SwarmRun run) {
        TaskPlan plan = run.plan();
        if (plan == null) {
            return NO_PLAN_MESSAGE;
        }
        List<AgentRunResult> completed = run.completed();
        if (completed.isEmpty()) {
            return NO_RESULTS_MESSAGE;
        }
        try {
            String answer = synthesisOracle.synthesize(plan, completed);
            if (StringUtils.hasText(answer)) {
                return answer;
            }
            log.warn("Synthesis returned an empty answer; listing raw results.");
        } catch (RuntimeException ex) {
            log.warn("Synthesis failed ({}); listing raw results.", ex.getMessage());
        }
        return promptService.fallbackAnswer(completed);
    }

    @Nullable
    private TaskPlan sanitize(@Nullable TaskPlan plan) {
        if (plan == null || plan.mode() == null) {
            return null;
        }
        if (plan.mode() == TaskMode.PRE_ASSIGNED) {
            List<String> units = plan.subInstructions().stream().filter(StringUtils::hasText).toList();
            if (units.isEmpty()) {
                return null;
            }
            if (units.size() > maxAgents) {
                log.warn("Plan lists {} units; only the first {} are kept.", units.size(), maxAgents);
                units = units.subList(0, maxAgents);
            }
            return new TaskPlan(TaskMode.PRE_ASSIGNED, plan.instruction(), units.size(), units, "", null);
        }
        int targetCount = Math.max(1, Math.min(plan.targetCount(), maxAgents));
        String template = StringUtils.hasText(plan.sharedTemplate()) ? plan.sharedTemplate() : plan.instruction();
        return new TaskPlan(plan.mode(), plan.instruction(), targetCount, List.of(), template, plan.comparisonCriterion());
    }

    private void advance(SwarmRun run, RunPhase phase) {
        run.phase(phase);
        log.info("Run {} entering {}.", run.runId(), phase.wireName());
        publishRunStatus(run);
    }

    private void publishRunStatus(SwarmRun run) {
        if (run != currentRun) {
            return;
        }
        emit(EVENT_RUN_STATUS, status());
    }

    private void emit(String type, Object payload) {
        try {
            listener.onEvent(type, payload);
        } catch (RuntimeException ex) {
            log.warn("Listener failed on {} event: {}", type, ex.getMessage());
        }
    }

    private SwarmRunResult toResult(SwarmRun run, List<String> skipped, String answer, @Nullable String error) {
        return new SwarmRunResult(run.runId(), run.instruction(), run.plan(), run.results(), List.copyOf(skipped),
                answer, run.phase(), error, run.startedAt(), Instant.now());
    }

    private static String abbreviate(String value) {
        return value.length() <= 100 ? value : value.substring(0, 100) + "...";
    }
}
