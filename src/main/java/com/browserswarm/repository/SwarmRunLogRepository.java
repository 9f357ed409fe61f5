package com.browserswarm.repository;

import com.browserswarm.entity.SwarmRunLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link SwarmRunLog} entities.
 */
public interface SwarmRunLogRepository extends JpaRepository<SwarmRunLog, UUID> {

    List<SwarmRunLog> findTop20ByOrderByCreatedAtDesc();

    Optional<SwarmRunLog> findByRunId(String runId);
}
