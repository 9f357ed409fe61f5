package com.browserswarm.pool;

import com.browserswarm.config.SwarmProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest {

    private final FakeTransport transport = new FakeTransport();
    private final List<PoolStatus> published = new CopyOnWriteArrayList<>();
    private WorkerPool pool;

    @AfterEach
    void tearDown() {
        transport.unblock();
        if (pool != null) {
            pool.shutdown();
        }
    }

    private WorkerPool newPool(int size) {
        SwarmProperties.Pool config = new SwarmProperties.Pool();
        config.setHealthTimeout(Duration.ofSeconds(2));
        config.setAssignmentTimeout(Duration.ofSeconds(2));
        pool = new WorkerPool(config, transport, new RegexFieldExtractor(), published::add);
        pool.initialize(size);
        return pool;
    }

    @Test
    void testInitializeMarksReachableWorkersIdle() {
        newPool(3);

        PoolStatus status = pool.status();
        assertEquals(3, status.totalWorkers());
        assertEquals(3, status.idle());
        assertEquals("worker-2", status.workers().get(1).endpoint().host());
        assertEquals(8767, status.workers().get(1).endpoint().videoPort());
        assertFalse(published.isEmpty());
    }

    @Test
    void testInitializeRejectsNonPositiveSize() {
        SwarmProperties.Pool config = new SwarmProperties.Pool();
        pool = new WorkerPool(config, transport, new RegexFieldExtractor(), null);
        assertThrows(IllegalArgumentException.class, () -> pool.initialize(0));
    }

    @Test
    void testProbeOutcomesAndRefresh() {
        transport.probeCodes.put(2, 500);
        transport.unreachable.add(3);
        newPool(3);

        PoolStatus status = pool.status();
        assertEquals(1, status.idle());
        assertEquals(1, status.error());
        assertEquals(1, status.starting());

        transport.probeCodes.clear();
        transport.unreachable.clear();
        pool.refreshHealth();

        assertEquals(3, pool.status().idle());
    }

    @Test
    void testAcquireIdleIsBoundedAndDistinct() {
        newPool(4);

        assertTrue(pool.acquireIdle(0).isEmpty());
        assertEquals(2, pool.acquireIdle(2).size());

        List<WorkerSnapshot> all = pool.acquireIdle(10);
        assertEquals(4, all.size());
        Set<Integer> ids = new HashSet<>();
        all.forEach(snapshot -> ids.add(snapshot.workerId()));
        assertEquals(4, ids.size());
        assertEquals(4, pool.status().idle());
    }

    @Test
    void testAssignSuccessExtractsFieldsAndReleasesWorker() {
        transport.answer = instruction -> new WorkerResponse(200,
                "Stripe is valued at $50 billion according to Bloomberg.", "success");
        newPool(2);

        UnitResult result = pool.assign(1, "Stripe", "Find Stripe's valuation");

        assertTrue(result.isCompleted());
        assertEquals("Stripe", result.label());
        assertEquals("$50 billion", result.fields().valuation());
        assertEquals("High", result.fields().confidence());
        assertEquals(WorkerState.IDLE, pool.status().workers().get(0).state());
    }

    @Test
    void testAssignNonOkStatusFailsAndReleases() {
        transport.answer = instruction -> new WorkerResponse(500, null, null);
        newPool(1);

        UnitResult result = pool.assign(1, "Stripe", "Find Stripe's valuation");

        assertFalse(result.isCompleted());
        assertEquals("Worker returned status 500", result.error());
        assertEquals(1, pool.status().idle());
        assertNull(pool.status().workers().get(0).currentAssignment());
    }

    @Test
    void testAssignWorkerReportedErrorFails() {
        transport.answer = instruction -> new WorkerResponse(200, "Error: browser crashed", "error");
        newPool(1);

        UnitResult result = pool.assign(1, null, "Find something");

        assertFalse(result.isCompleted());
        assertEquals("Error: browser crashed", result.error());
        assertEquals(1, pool.status().idle());
        assertNull(pool.status().workers().get(0).currentAssignment());
    }

    @Test
    void testAssignTransportFailureReleasesWorker() {
        transport.answer = instruction -> {
            throw new WorkerTransportException("connection refused");
        };
        newPool(1);

        UnitResult result = pool.assign(1, "Plaid", "Find Plaid's valuation");

        assertFalse(result.isCompleted());
        assertTrue(result.error().contains("connection refused"));
        WorkerSnapshot worker = pool.status().workers().get(0);
        assertEquals(WorkerState.IDLE, worker.state());
        assertNull(worker.currentAssignment());
        assertNull(worker.assignedLabel());
    }

    @Test
    void testAssignTimeoutReleasesWorker() {
        transport.block = true;
        SwarmProperties.Pool config = new SwarmProperties.Pool();
        config.setAssignmentTimeout(Duration.ofSeconds(1));
        pool = new WorkerPool(config, transport, new RegexFieldExtractor(), null);
        pool.initialize(1);

        UnitResult result = pool.assign(1, "Brex", "Find Brex's valuation");

        assertFalse(result.isCompleted());
        assertEquals("Worker 1 timed out after 1s", result.error());
        assertEquals(1, pool.status().idle());
        assertNull(pool.status().workers().get(0).currentAssignment());
        List<WorkerSnapshot> reacquired = pool.acquireIdle(1);
        assertEquals(1, reacquired.size());
        assertEquals(1, reacquired.get(0).workerId());
    }

    @Test
    void testSubSecondTimeoutIsReportedInMillis() {
        transport.block = true;
        SwarmProperties.Pool config = new SwarmProperties.Pool();
        config.setAssignmentTimeout(Duration.ofMillis(200));
        pool = new WorkerPool(config, transport, new RegexFieldExtractor(), null);
        pool.initialize(1);

        UnitResult result = pool.assign(1, "Mercury", "Find Mercury's valuation");

        assertEquals("Worker 1 timed out after 200ms", result.error());
        assertEquals(1, pool.status().idle());
    }

    @Test
    void testFormatTimeout() {
        assertEquals("250ms", WorkerPool.formatTimeout(Duration.ofMillis(250)));
        assertEquals("1s", WorkerPool.formatTimeout(Duration.ofMillis(1500)));
        assertEquals("120s", WorkerPool.formatTimeout(Duration.ofMinutes(2)));
    }

    @Test
    void testAssignUnknownOrBusyWorker() throws Exception {
        transport.block = true;
        newPool(1);

        UnitResult missing = pool.assign(7, null, "anything");
        assertEquals("Worker 7 not found", missing.error());

        Thread running = new Thread(() -> pool.assign(1, "Ramp", "Find Ramp's valuation"));
        running.start();
        assertTrue(transport.started.await(2, TimeUnit.SECONDS));

        UnitResult busy = pool.assign(1, "Other", "anything");
        assertEquals("Worker 1 is not idle (RUNNING)", busy.error());
        WorkerSnapshot busyWorker = pool.status().workers().get(0);
        assertEquals("Ramp", busyWorker.assignedLabel());
        assertEquals("Find Ramp's valuation", busyWorker.currentAssignment());

        transport.unblock();
        running.join(5000);
        assertEquals(1, pool.status().idle());
    }

    @Test
    void testExecuteParallelDropsUnitsBeyondIdleWorkers() {
        transport.answer = instruction -> new WorkerResponse(200, "done: " + instruction, "success");
        newPool(2);

        List<UnitResult> results = pool.executeParallel(List.of(
                new WorkUnit("A", "a"),
                new WorkUnit("B", "b"),
                new WorkUnit("C", "c")));

        assertEquals(2, results.size());
        assertEquals("A", results.get(0).label());
        assertEquals("done: b", results.get(1).rawResponse());
        assertNotEquals(results.get(0).workerId(), results.get(1).workerId());
        assertEquals(2, pool.status().idle());
    }

    @Test
    void testExecuteParallelWithoutIdleWorkers() {
        transport.unreachable.add(1);
        newPool(1);

        List<UnitResult> results = pool.executeParallel(List.of(new WorkUnit("A", "a"), new WorkUnit("B", "b")));

        assertEquals(2, results.size());
        results.forEach(result -> {
            assertEquals(0, result.workerId());
            assertEquals(WorkerPool.NO_IDLE_WORKERS, result.error());
        });
    }

    @Test
    void testConcurrentAssignmentsNeverShareWorker() {
        transport.answer = instruction -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new WorkerResponse(200, instruction, "success");
        };
        newPool(4);

        List<WorkUnit> units = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            units.add(new WorkUnit("T" + i, "task " + i));
        }
        List<UnitResult> results = pool.executeParallel(units);

        assertEquals(4, results.size());
        assertEquals(4, results.stream().filter(UnitResult::isCompleted).count());
        Set<Integer> workerIds = new HashSet<>();
        results.forEach(result -> assertTrue(workerIds.add(result.workerId()),
                "worker " + result.workerId() + " was assigned twice"));
        assertEquals(4, pool.status().idle());
    }

    @Test
    void testShutdownIsIdempotent() {
        newPool(2);

        pool.shutdown();
        pool.shutdown();

        assertEquals(1, transport.closeCount.get());
        assertEquals(2, pool.status().stopping());
    }

    static class FakeTransport implements WorkerTransport {
        final Map<Integer, Integer> probeCodes = new ConcurrentHashMap<>();
        final Set<Integer> unreachable = ConcurrentHashMap.newKeySet();
        final AtomicInteger closeCount = new AtomicInteger();
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        volatile boolean block;
        volatile Function<String, WorkerResponse> answer = instruction -> new WorkerResponse(200, "ok", "success");

        @Override
        public int probe(WorkerEndpoint endpoint) {
            if (unreachable.contains(endpoint.workerId())) {
                throw new WorkerTransportException("unreachable");
            }
            return probeCodes.getOrDefault(endpoint.workerId(), 200);
        }

        @Override
        public WorkerResponse execute(WorkerEndpoint endpoint, String instruction) {
            if (block) {
                started.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return answer.apply(instruction);
        }

        @Override
        public void close() {
            closeCount.incrementAndGet();
        }

        void unblock() {
            release.countDown();
        }
    }
}
