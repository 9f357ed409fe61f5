package com.browserswarm.api;

import com.browserswarm.pool.PoolStatus;
import com.browserswarm.pool.ResultTableFormatter;
import com.browserswarm.pool.UnitResult;
import com.browserswarm.pool.WorkUnit;
import com.browserswarm.pool.WorkerPool;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/workers")
@ConditionalOnProperty(name = "swarm.worker.enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class WorkerPoolController {

    private final WorkerPool workerPool;

    public WorkerPoolController(WorkerPool workerPool) {
        this.workerPool = workerPool;
    }

    @GetMapping
    public PoolStatus status() {
        return workerPool.status();
    }

    @PostMapping("/execute")
    public UnitBatchResponse execute(@Valid @RequestBody UnitBatchRequest request) {
        String batchId = UUID.randomUUID().toString().substring(0, 8);
        long started = System.nanoTime();
        List<WorkUnit> units = request.units().stream()
                .map(unit -> new WorkUnit(unit.label(), unit.instruction()))
                .toList();
        log.info("Batch {}: executing {} units.", batchId, units.size());
        List<UnitResult> results = workerPool.executeParallel(units);
        double duration = (System.nanoTime() - started) / 1_000_000_000.0;
        int workersUsed = (int) results.stream().filter(result -> result.workerId() > 0).count();
        String table = ResultTableFormatter.table(results);
        String summary = ResultTableFormatter.summary(results, workersUsed, duration);
        return new UnitBatchResponse(batchId, results, table + "\n\n" + summary, summary, workersUsed);
    }
}
