package com.eyelevel.documentindexer.service.orchestrator;

import com.eyelevel.documentindexer.model.JobStatus;
import com.eyelevel.documentindexer.model.PipelinePhase;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one pipeline run. {@code failure} is {@code null} exactly when the job completed.
 *
 * @param creditsUsed   credits charged to the user; always 0 for a failed job.
 * @param reservationId credit reservation held for the job, or {@code null} if reserving failed.
 */
public record OrchestrationSummary(UUID jobId, List<PipelinePhase> phasesDone, JobStatus jobStatus, int totalChunks,
                                   int totalEmbeddings, int creditsUsed, Long reservationId,
                                   PipelineFailure failure) {

    public boolean isSuccessful() {
        return jobStatus == JobStatus.COMPLETED;
    }
}
