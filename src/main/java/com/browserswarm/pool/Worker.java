package com.browserswarm.pool;

import lombok.Getter;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Mutable worker handle. Every mutation happens under the owning pool's lock.
 */
@Getter
class Worker {

    private final int id;
    private final WorkerEndpoint endpoint;
    private final Instant startedAt;
    private WorkerState state = WorkerState.STARTING;
    @Nullable
    private String currentAssignment;
    @Nullable
    private String assignedLabel;
    @Nullable
    private Instant lastHeartbeat;

    Worker(WorkerEndpoint endpoint) {
        this.id = endpoint.workerId();
        this.endpoint = endpoint;
        this.startedAt = Instant.now();
    }

    void markRunning(@Nullable String label, String instruction) {
        this.state = WorkerState.RUNNING;
        this.assignedLabel = label;
        this.currentAssignment = instruction;
    }

    void release() {
        this.state = WorkerState.IDLE;
        this.assignedLabel = null;
        this.currentAssignment = null;
    }

    void markHealthy(Instant heartbeat) {
        this.state = WorkerState.IDLE;
        this.lastHeartbeat = heartbeat;
    }

    void markState(WorkerState state) {
        this.state = state;
    }

    WorkerSnapshot snapshot() {
        return new WorkerSnapshot(id, state, assignedLabel, currentAssignment, lastHeartbeat, endpoint);
    }
}
