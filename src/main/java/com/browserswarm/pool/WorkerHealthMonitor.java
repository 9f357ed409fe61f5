package com.browserswarm.pool;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "swarm.worker.enabled", havingValue = "false", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class WorkerHealthMonitor {

    private final WorkerPool workerPool;

    @Scheduled(initialDelayString = "${swarm.pool.health-interval:30s}", fixedDelayString = "${swarm.pool.health-interval:30s}")
    public void refresh() {
        try {
            workerPool.refreshHealth();
        } catch (RuntimeException ex) {
            log.warn("Worker health refresh failed: {}", ex.getMessage());
        }
    }
}
