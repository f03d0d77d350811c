package com.eyelevel.documentindexer.service.job;

import com.eyelevel.documentindexer.exception.JobNotFoundException;
import com.eyelevel.documentindexer.model.IndexingJob;
import com.eyelevel.documentindexer.model.JobStatus;
import com.eyelevel.documentindexer.model.PipelinePhase;
import com.eyelevel.documentindexer.repository.IndexingJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns every state change of an {@link IndexingJob}. Each transition is flushed immediately but never
 * committed here: the caller that opened the transaction decides when the job's work becomes durable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStore {

    private final IndexingJobRepository indexingJobRepository;

    /**
     * Creates a job in {@link JobStatus#QUEUED} positioned at the convert phase.
     */
    public IndexingJob create(UUID projectId, UUID fileId, UUID userId, boolean needsOcr) {
        IndexingJob job = IndexingJob.builder()
                                     .projectId(projectId)
                                     .fileId(fileId)
                                     .userId(userId)
                                     .needsOcr(needsOcr)
                                     .status(JobStatus.QUEUED)
                                     .phaseCurrent(PipelinePhase.CONVERT)
                                     .progressPct(0)
                                     .build();
        IndexingJob saved = indexingJobRepository.saveAndFlush(job);
        log.info("[JobId: {}, FileId: {}] Indexing job created in status QUEUED.", saved.getJobId(), fileId);
        return saved;
    }

    public Optional<IndexingJob> findById(UUID jobId) {
        return indexingJobRepository.findById(jobId);
    }

    /**
     * @throws JobNotFoundException if no job has this id.
     */
    public IndexingJob getById(UUID jobId) {
        return indexingJobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Jobs of a project, newest first.
     */
    public List<IndexingJob> listByProject(UUID projectId, int limit, int offset) {
        if (limit <= 0 || offset < 0) {
            throw new IllegalArgumentException("limit must be positive and offset non-negative");
        }
        return indexingJobRepository.findByProjectIdOrderByCreatedAtDesc(projectId, PageRequest.of(0, offset + limit))
                                    .stream()
                                    .skip(offset)
                                    .toList();
    }

    public IndexingJob markRunning(IndexingJob job) {
        job.setStatus(JobStatus.RUNNING);
        job.setStartedAt(LocalDateTime.now());
        IndexingJob saved = indexingJobRepository.saveAndFlush(job);
        log.info("[JobId: {}] Job moved to RUNNING.", job.getJobId());
        return saved;
    }

    /**
     * Records that {@code phase} finished. Status is left untouched.
     */
    public IndexingJob updatePhase(IndexingJob job, PipelinePhase phase) {
        job.advanceTo(phase);
        IndexingJob saved = indexingJobRepository.saveAndFlush(job);
        log.debug("[JobId: {}] Phase {} recorded ({}%).", job.getJobId(), phase, phase.progressPct());
        return saved;
    }

    public IndexingJob markCompleted(IndexingJob job) {
        job.advanceTo(PipelinePhase.READY);
        job.setStatus(JobStatus.COMPLETED);
        job.setCompletedAt(LocalDateTime.now());
        IndexingJob saved = indexingJobRepository.saveAndFlush(job);
        log.info("Successfully marked Job ID {} as COMPLETED.", job.getJobId());
        return saved;
    }

    /**
     * Marks the job FAILED. The current phase is kept so the timeline shows where the pipeline stopped.
     */
    public IndexingJob markFailed(IndexingJob job, String errorMessage) {
        job.setStatus(JobStatus.FAILED);
        job.setFailedAt(LocalDateTime.now());
        job.setErrorMessage(errorMessage);
        IndexingJob saved = indexingJobRepository.saveAndFlush(job);
        log.warn("Marked Job ID {} as FAILED at phase {}. Reason: {}", job.getJobId(), job.getPhaseCurrent(),
                 errorMessage);
        return saved;
    }
}
