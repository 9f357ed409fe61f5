package com.browserswarm.orchestration.service;

import com.browserswarm.entity.SwarmRunLog;
import com.browserswarm.orchestration.model.SwarmRunResult;
import com.browserswarm.repository.SwarmRunLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

@Service
@ConditionalOnProperty(name = "swarm.worker.enabled", havingValue = "false", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RunHistoryService {

    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_COMPLETED_WITH_ERROR = "COMPLETED_WITH_ERROR";

    private final SwarmRunLogRepository repository;

    /**
     * Stores a summary of a finished run. Storage failures are logged and swallowed so they
     * never fail the run itself.
     */
    public void record(SwarmRunResult result) {
        SwarmRunLog entry = SwarmRunLog.builder()
                .runId(result.runId())
                .instruction(result.instruction())
                .mode(result.plan() != null ? result.plan().mode().wireName() : null)
                .targetCount(result.plan() != null ? result.plan().targetCount() : 0)
                .completedCount((int) result.completedCount())
                .failedCount((int) result.failedCount())
                .skippedCount(result.skippedUnits().size())
                .finalAnswer(result.finalAnswer())
                .error(result.error())
                .status(result.hasError() ? STATUS_COMPLETED_WITH_ERROR : STATUS_COMPLETED)
                .durationMs(Duration.between(result.startedAt(), result.finishedAt()).toMillis())
                .build();
        try {
            repository.save(entry);
        } catch (DataAccessException ex) {
            log.error("Failed to store history for run {}: {}", result.runId(), ex.getMessage());
        }
    }

    public List<SwarmRunLog> recentRuns() {
        return repository.findTop20ByOrderByCreatedAtDesc();
    }
}
