package com.browserswarm.pool;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class WorkerHealthMonitorTest {

    private final WorkerPool workerPool = mock(WorkerPool.class);
    private final WorkerHealthMonitor monitor = new WorkerHealthMonitor(workerPool);

    @Test
    void testRefreshDelegatesToPool() {
        monitor.refresh();
        verify(workerPool).refreshHealth();
    }

    @Test
    void testRefreshFailureIsContained() {
        doThrow(new IllegalStateException("executor closed")).when(workerPool).refreshHealth();
        assertDoesNotThrow(monitor::refresh);
    }
}
