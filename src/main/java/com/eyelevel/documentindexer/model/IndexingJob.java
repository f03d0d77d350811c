package com.eyelevel.documentindexer.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Durable record of one indexing run for one file. Rows are never deleted; a finished job stays as
 * the audit record of what happened to the file.
 */
@Entity
@Table(name = "indexing_job", indexes = {
        @Index(name = "idx_indexing_job_project_created", columnList = "project_id, created_at"),
        @Index(name = "idx_indexing_job_file", columnList = "file_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexingJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "job_id", updatable = false, nullable = false)
    private UUID jobId;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(name = "file_id", nullable = false, updatable = false)
    private UUID fileId;

    /**
     * The user who submitted the job and whose credits are reserved for it.
     */
    @Column(name = "user_id", updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase_current", length = 20)
    private PipelinePhase phaseCurrent;

    @Builder.Default
    @Column(name = "needs_ocr", nullable = false)
    private boolean needsOcr = false;

    @Builder.Default
    @Column(name = "progress_pct", nullable = false)
    private int progressPct = 0;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "failed_at")
    private LocalDateTime failedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    /**
     * Moves the job to the given phase and keeps {@code progressPct} in step with it.
     */
    public void advanceTo(PipelinePhase phase) {
        this.phaseCurrent = phase;
        this.progressPct = phase.progressPct();
    }

    /**
     * The moment the job reached a terminal status, or {@code null} while it is still in flight.
     */
    @Transient
    public LocalDateTime getFinishedAt() {
        if (status == null) {
            return null;
        }
        return switch (status) {
            case QUEUED, RUNNING -> null;
            case COMPLETED -> completedAt;
            case FAILED -> failedAt;
            case CANCELLED -> cancelledAt;
        };
    }
}
