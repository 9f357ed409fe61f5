package com.browserswarm.pool;

import com.browserswarm.config.SwarmProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-size registry of browser workers that brokers exclusive task assignment.
 * <p>
 * Workers live in slots indexed by {@code id - 1}. Every read-then-write on worker state
 * happens under a single lock owned by this instance; remote calls are made outside it.
 * An assignment always releases its worker back to {@link WorkerState#IDLE}, whatever
 * the outcome of the remote call.
 */
@Slf4j
public class WorkerPool {

    static final String NO_IDLE_WORKERS = "No idle workers available";

    private final SwarmProperties.Pool config;
    private final WorkerTransport transport;
    private final StructuredFieldExtractor fieldExtractor;
    private final PoolStateListener listener;
    private final ExecutorService executor;
    private final ReentrantLock lock = new ReentrantLock();

    private Worker[] workers = new Worker[0];
    private boolean shutdown;

    public WorkerPool(SwarmProperties.Pool config,
                      WorkerTransport transport,
                      StructuredFieldExtractor fieldExtractor,
                      @Nullable PoolStateListener listener) {
        this.config = config;
        this.transport = transport;
        this.fieldExtractor = fieldExtractor;
        this.listener = listener != null ? listener : PoolStateListener.NONE;
        this.executor = Executors.newCachedThreadPool();
    }

    /**
     * Builds {@code size} worker handles and probes all of them concurrently.
     * Probe failures are expected while workers boot and never abort initialization.
     */
    public void initialize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Pool size must be positive: " + size);
        }
        lock.lock();
        try {
            Worker[] slots = new Worker[size];
            for (int i = 0; i < size; i++) {
                slots[i] = new Worker(WorkerEndpoint.forWorker(i + 1, config));
            }
            workers = slots;
            shutdown = false;
        } finally {
            lock.unlock();
        }
        log.info("Initializing worker pool with {} workers.", size);
        probeAll(snapshotWorkers(WorkerState.STARTING, WorkerState.IDLE, WorkerState.ERROR));
        PoolStatus status = status();
        log.info("Worker pool ready: {} idle, {} starting, {} error.", status.idle(), status.starting(), status.error());
    }

    /**
     * Re-probes workers that are still starting or in error. Running and stopping workers are left alone.
     */
    public void refreshHealth() {
        List<Worker> candidates = snapshotWorkers(WorkerState.STARTING, WorkerState.ERROR);
        if (candidates.isEmpty()) {
            return;
        }
        log.debug("Refreshing health of {} workers.", candidates.size());
        probeAll(candidates);
    }

    /**
     * Returns up to {@code n} idle workers without claiming them. Never waits for workers to free up.
     */
    public List<WorkerSnapshot> acquireIdle(int n) {
        if (n <= 0) {
            return List.of();
        }
        lock.lock();
        try {
            List<WorkerSnapshot> idle = new ArrayList<>();
            for (Worker worker : workers) {
                if (idle.size() >= n) {
                    break;
                }
                if (worker.getState() == WorkerState.IDLE) {
                    idle.add(worker.snapshot());
                }
            }
            return idle;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs one instruction on one worker. Never throws: absent or busy workers, transport errors,
     * non-200 answers and timeouts all come back as a failed {@link UnitResult}.
     */
    public UnitResult assign(int workerId, @Nullable String label, String instruction) {
        long started = System.nanoTime();
        Worker worker;
        lock.lock();
        try {
            worker = find(workerId);
            if (worker == null) {
                return UnitResult.failed(workerId, label, "Worker %d not found".formatted(workerId), elapsedSeconds(started));
            }
            if (worker.getState() != WorkerState.IDLE) {
                return UnitResult.failed(workerId, label,
                        "Worker %d is not idle (%s)".formatted(workerId, worker.getState()), elapsedSeconds(started));
            }
            worker.markRunning(label, instruction);
        } finally {
            lock.unlock();
        }
        log.info("Worker {} assigned {}.", workerId, label != null ? label : "unlabeled unit");
        publishStatus();

        try {
            WorkerEndpoint endpoint = worker.getEndpoint();
            Duration timeout = config.getAssignmentTimeout();
            WorkerResponse response = CompletableFuture
                    .supplyAsync(() -> transport.execute(endpoint, instruction), executor)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .join();
            return toUnitResult(workerId, label, response, elapsedSeconds(started));
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            String reason = cause instanceof TimeoutException
                    ? "Worker %d timed out after %s".formatted(workerId, formatTimeout(config.getAssignmentTimeout()))
                    : describe(cause);
            log.error("Worker {} failed on {}: {}", workerId, label, reason);
            return UnitResult.failed(workerId, label, reason, elapsedSeconds(started));
        } catch (RuntimeException ex) {
            log.error("Worker {} failed on {}: {}", workerId, label, describe(ex));
            return UnitResult.failed(workerId, label, describe(ex), elapsedSeconds(started));
        } finally {
            release(worker);
        }
    }

    /**
     * Pairs available idle workers with units one to one and runs every pair concurrently.
     * Units beyond the number of idle workers are dropped from this batch.
     */
    public List<UnitResult> executeParallel(List<WorkUnit> units) {
        if (units.isEmpty()) {
            return List.of();
        }
        List<WorkerSnapshot> idle = acquireIdle(units.size());
        if (idle.isEmpty()) {
            log.warn("No idle workers for {} units.", units.size());
            return units.stream()
                    .map(unit -> UnitResult.failed(0, unit.label(), NO_IDLE_WORKERS, 0.0))
                    .toList();
        }
        if (idle.size() < units.size()) {
            log.warn("Only {} idle workers for {} units; {} units dropped from this batch.",
                    idle.size(), units.size(), units.size() - idle.size());
        }
        List<CompletableFuture<UnitResult>> futures = new ArrayList<>();
        for (int i = 0; i < idle.size(); i++) {
            WorkUnit unit = units.get(i);
            int workerId = idle.get(i).workerId();
            futures.add(CompletableFuture.supplyAsync(() -> assign(workerId, unit.label(), unit.instruction()), executor));
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    public PoolStatus status() {
        lock.lock();
        try {
            Map<WorkerState, Integer> counts = new EnumMap<>(WorkerState.class);
            List<WorkerSnapshot> snapshots = new ArrayList<>(workers.length);
            for (Worker worker : workers) {
                counts.merge(worker.getState(), 1, Integer::sum);
                snapshots.add(worker.snapshot());
            }
            return new PoolStatus(
                    workers.length,
                    counts.getOrDefault(WorkerState.IDLE, 0),
                    counts.getOrDefault(WorkerState.RUNNING, 0),
                    counts.getOrDefault(WorkerState.ERROR, 0),
                    counts.getOrDefault(WorkerState.STARTING, 0),
                    counts.getOrDefault(WorkerState.STOPPING, 0),
                    List.copyOf(snapshots));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return workers.length;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks every worker stopping and releases the outbound transport. Safe to call more than once.
     */
    public void shutdown() {
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            for (Worker worker : workers) {
                worker.markState(WorkerState.STOPPING);
            }
        } finally {
            lock.unlock();
        }
        log.info("Shutting down worker pool.");
        try {
            transport.close();
        } catch (Exception ex) {
            log.warn("Failed to close worker transport: {}", ex.getMessage());
        }
        executor.shutdown();
        publishStatus();
    }

    private UnitResult toUnitResult(int workerId, @Nullable String label, WorkerResponse response, double elapsed) {
        if (!response.isOk()) {
            String reason = "Worker returned status " + response.statusCode();
            log.error("Worker {} failed on {}: {}", workerId, label, reason);
            return UnitResult.failed(workerId, label, reason, elapsed);
        }
        String text = response.responseText() != null ? response.responseText() : "";
        if (WorkerExecuteResponse.STATUS_ERROR.equalsIgnoreCase(response.status())) {
            log.error("Worker {} reported an error on {}.", workerId, label);
            return UnitResult.failed(workerId, label, text, elapsed);
        }
        log.info("Worker {} completed {} in {}s.", workerId, label, "%.1f".formatted(elapsed));
        return UnitResult.completed(workerId, label, text, fieldExtractor.extract(text), elapsed);
    }

    private void probeAll(List<Worker> targets) {
        List<CompletableFuture<Void>> probes = new ArrayList<>();
        for (Worker worker : targets) {
            WorkerEndpoint endpoint = worker.getEndpoint();
            probes.add(CompletableFuture
                    .supplyAsync(() -> transport.probe(endpoint), executor)
                    .orTimeout(config.getHealthTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .handle((code, ex) -> {
                        applyProbe(worker, code, ex);
                        return null;
                    }));
        }
        CompletableFuture.allOf(probes.toArray(new CompletableFuture[0])).join();
        publishStatus();
    }

    private void applyProbe(Worker worker, @Nullable Integer code, @Nullable Throwable failure) {
        lock.lock();
        try {
            WorkerState current = worker.getState();
            if (current == WorkerState.RUNNING || current == WorkerState.STOPPING) {
                return;
            }
            if (failure == null && code != null && code == 200) {
                worker.markHealthy(Instant.now());
                if (current != WorkerState.IDLE) {
                    log.info("Worker {} is healthy.", worker.getId());
                }
            } else if (failure == null) {
                worker.markState(WorkerState.ERROR);
                log.warn("Worker {} health check returned status {}.", worker.getId(), code);
            } else {
                worker.markState(WorkerState.STARTING);
                log.debug("Worker {} not reachable yet: {}", worker.getId(), describe(failure));
            }
        } finally {
            lock.unlock();
        }
    }

    private void release(Worker worker) {
        lock.lock();
        try {
            if (worker.getState() == WorkerState.STOPPING) {
                return;
            }
            worker.release();
        } finally {
            lock.unlock();
        }
        publishStatus();
    }

    private List<Worker> snapshotWorkers(WorkerState... states) {
        lock.lock();
        try {
            List<Worker> matching = new ArrayList<>();
            for (Worker worker : workers) {
                for (WorkerState state : states) {
                    if (worker.getState() == state) {
                        matching.add(worker);
                        break;
                    }
                }
            }
            return matching;
        } finally {
            lock.unlock();
        }
    }

    @Nullable
    private Worker find(int workerId) {
        if (workerId < 1 || workerId > workers.length) {
            return null;
        }
        return workers[workerId - 1];
    }

    private void publishStatus() {
        try {
            listener.onPoolStateChanged(status());
        } catch (RuntimeException ex) {
            log.warn("Pool state listener failed: {}", ex.getMessage());
        }
    }

    static String formatTimeout(Duration timeout) {
        return timeout.compareTo(Duration.ofSeconds(1)) < 0
                ? timeout.toMillis() + "ms"
                : timeout.toSeconds() + "s";
    }

    private static String describe(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static double elapsedSeconds(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000_000.0;
    }
}
