package com.browserswarm.pool;

import java.util.List;

public record PoolStatus(
        int totalWorkers,
        int idle,
        int running,
        int error,
        int starting,
        int stopping,
        List<WorkerSnapshot> workers
) {
}
