package com.eyelevel.documentindexer.service.progress;

import com.eyelevel.documentindexer.model.JobStatus;
import com.eyelevel.documentindexer.model.PipelinePhase;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Snapshot of a job for status polling.
 *
 * @param progressPct derived from {@code phase}, not from the last event.
 * @param finishedAt  when the job reached a terminal status, or {@code null}.
 */
public record JobProgress(UUID jobId, UUID projectId, UUID fileId, PipelinePhase phase, JobStatus status,
                          int progressPct, String errorMessage, LocalDateTime startedAt, LocalDateTime finishedAt,
                          LocalDateTime updatedAt, int eventCount, List<TimelineEntry> timeline) {
}
