package com.browserswarm.repository;

import com.browserswarm.entity.SwarmRunLog;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SwarmRunLogRepositoryTest extends BaseRepositoryTest {

    @Autowired
    private SwarmRunLogRepository swarmRunLogRepository;

    private SwarmRunLog entry(String runId) {
        return SwarmRunLog.builder()
                .runId(runId)
                .instruction("Find 3 fintech startups")
                .mode("dynamic_discovery")
                .targetCount(3)
                .completedCount(2)
                .failedCount(1)
                .status("COMPLETED")
                .durationMs(4200)
                .build();
    }

    @Test
    void testSaveAndFind() {
        SwarmRunLog saved = swarmRunLogRepository.save(entry("run-42"));
        assertNotNull(saved.getId());

        Optional<SwarmRunLog> found = swarmRunLogRepository.findByRunId("run-42");
        assertTrue(found.isPresent());
        assertEquals("dynamic_discovery", found.get().getMode());
        assertNotNull(found.get().getCreatedAt());
    }

    @Test
    void testRecentRunsAreLimited() {
        for (int i = 0; i < 25; i++) {
            swarmRunLogRepository.save(entry("run-" + i));
        }
        swarmRunLogRepository.flush();

        List<SwarmRunLog> recent = swarmRunLogRepository.findTop20ByOrderByCreatedAtDesc();
        assertEquals(20, recent.size());
    }
}
