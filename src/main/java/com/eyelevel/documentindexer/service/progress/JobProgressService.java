package com.eyelevel.documentindexer.service.progress;

import com.eyelevel.documentindexer.model.IndexingJob;
import com.eyelevel.documentindexer.service.job.JobEventLog;
import com.eyelevel.documentindexer.service.job.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Read-only views of indexing jobs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobProgressService {

    private final JobStore jobStore;
    private final JobEventLog jobEventLog;

    /**
     * @throws com.eyelevel.documentindexer.exception.JobNotFoundException if the job does not exist.
     */
    @Transactional(readOnly = true)
    public JobProgress getJobProgress(UUID jobId) {
        IndexingJob job = jobStore.getById(jobId);
        List<TimelineEntry> timeline = jobEventLog.timeline(jobId).stream().map(TimelineEntry::from).toList();
        log.debug("[JobId: {}] Progress requested: {} at {} with {} events.", jobId, job.getStatus(),
                  job.getPhaseCurrent(), timeline.size());
        return toProgress(job, timeline);
    }

    /**
     * Jobs of a project, newest first, without their timelines.
     */
    @Transactional(readOnly = true)
    public List<JobProgress> listProjectJobs(UUID projectId, int limit, int offset) {
        return jobStore.listByProject(projectId, limit, offset)
                       .stream()
                       .map(job -> toProgress(job, List.of()))
                       .toList();
    }

    private static JobProgress toProgress(IndexingJob job, List<TimelineEntry> timeline) {
        int progressPct = job.getPhaseCurrent() == null ? 0 : job.getPhaseCurrent().progressPct();
        return new JobProgress(job.getJobId(), job.getProjectId(), job.getFileId(), job.getPhaseCurrent(),
                               job.getStatus(), progressPct, job.getErrorMessage(), job.getStartedAt(),
                               job.getFinishedAt(), job.getUpdatedAt(), timeline.size(), timeline);
    }
}
