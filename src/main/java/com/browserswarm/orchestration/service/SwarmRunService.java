package com.browserswarm.orchestration.service;

import static com.browserswarm.orchestration.SwarmConstants.*;

import com.browserswarm.entity.SwarmRunLog;
import com.browserswarm.orchestration.SwarmCoordinator;
import com.browserswarm.orchestration.model.SwarmRunResult;
import com.browserswarm.orchestration.model.SwarmStatus;
import com.browserswarm.pool.WorkerPool;
import com.browserswarm.stream.StatusPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Front door for coordination runs: synchronous and background execution, claim
 * forwarding, status snapshots and run history.
 */
@Service
@ConditionalOnProperty(name = "swarm.worker.enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class SwarmRunService {

    private final SwarmCoordinator coordinator;
    private final WorkerPool workerPool;
    private final RunHistoryService historyService;
    private final StatusPublisher statusPublisher;
    private final ExecutorService orchestrationExecutor;

    public SwarmRunService(SwarmCoordinator coordinator,
                           WorkerPool workerPool,
                           RunHistoryService historyService,
                           StatusPublisher statusPublisher,
                           @Qualifier("orchestrationExecutor") ExecutorService orchestrationExecutor) {
        this.coordinator = coordinator;
        this.workerPool = workerPool;
        this.historyService = historyService;
        this.statusPublisher = statusPublisher;
        this.orchestrationExecutor = orchestrationExecutor;
    }

    public SwarmRunResult execute(String instruction) {
        return run(newRunId(), instruction);
    }

    /**
     * Starts a run in the background; progress and the final answer go to the status channel.
     */
    public String submit(String instruction) {
        String runId = newRunId();
        statusPublisher.publish(EVENT_STATUS, Map.of("runId", runId, "message", "Queued"));
        CompletableFuture.runAsync(() -> run(runId, instruction), orchestrationExecutor)
                .exceptionally(ex -> {
                    log.error("Background run {} failed: {}", runId, ex.getMessage());
                    statusPublisher.publish(EVENT_ERROR, Map.of("runId", runId, "message", String.valueOf(ex.getMessage())));
                    return null;
                });
        return runId;
    }

    public boolean claim(int agentId, String label) {
        return coordinator.claim(agentId, label);
    }

    public SwarmStatus status() {
        return coordinator.status();
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("pool", workerPool.status());
        snapshot.put("run", coordinator.status());
        return snapshot;
    }

    public List<SwarmRunLog> recentRuns() {
        return historyService.recentRuns();
    }

    private SwarmRunResult run(String runId, String instruction) {
        SwarmRunResult result = coordinator.execute(runId, instruction);
        historyService.record(result);
        statusPublisher.publish(EVENT_RUN_COMPLETE, result);
        return result;
    }

    private static String newRunId() {
        return UUID.randomUUID().toString();
    }
}
