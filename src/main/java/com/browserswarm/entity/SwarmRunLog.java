package com.browserswarm.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "swarm_run_log")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SwarmRunLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "run_id", nullable = false, length = 64)
    private String runId;

    @Column(name = "instruction", nullable = false, columnDefinition = "TEXT")
    private String instruction;

    @Column(name = "mode", length = 40)
    private String mode;

    @Column(name = "target_count")
    private int targetCount;

    @Column(name = "completed_count")
    private int completedCount;

    @Column(name = "failed_count")
    private int failedCount;

    @Column(name = "skipped_count")
    private int skippedCount;

    @Column(name = "final_answer", columnDefinition = "TEXT")
    private String finalAnswer;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Column(name = "status", length = 30)
    private String status;

    @Column(name = "duration_ms")
    private long durationMs;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
