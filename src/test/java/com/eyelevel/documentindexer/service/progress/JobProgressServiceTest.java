package com.eyelevel.documentindexer.service.progress;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eyelevel.documentindexer.exception.JobNotFoundException;
import com.eyelevel.documentindexer.model.IndexingJob;
import com.eyelevel.documentindexer.model.JobEventType;
import com.eyelevel.documentindexer.model.JobStatus;
import com.eyelevel.documentindexer.model.PipelinePhase;
import com.eyelevel.documentindexer.service.job.JobEventLog;
import com.eyelevel.documentindexer.service.job.JobStore;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

/**
 * Progress snapshots built from persisted jobs and their timelines.
 */
@DataJpaTest
@Import({JobStore.class, JobEventLog.class, JobProgressService.class})
class JobProgressServiceTest {

    @Autowired
    private JobStore jobStore;

    @Autowired
    private JobEventLog jobEventLog;

    @Autowired
    private JobProgressService jobProgressService;

    @Test
    void getJobProgress_derivesPercentFromPhaseAndReturnsTimelineInOrder() {
        IndexingJob job = jobStore.create(UUID.randomUUID(), UUID.randomUUID(), null, false);
        jobEventLog.append(job.getJobId(), JobEventType.JOB_QUEUED, PipelinePhase.CONVERT, 0, "Job queued", null);
        jobStore.markRunning(job);
        jobEventLog.append(job.getJobId(), JobEventType.JOB_RUNNING, PipelinePhase.CONVERT, 0, "Job running", null);
        jobStore.updatePhase(job, PipelinePhase.EMBED);
        jobEventLog.phaseCompleted(job.getJobId(), PipelinePhase.EMBED, 100, "Embedded",
                                   Map.of("embedded", 2));

        JobProgress progress = jobProgressService.getJobProgress(job.getJobId());

        assertEquals(JobStatus.RUNNING, progress.status());
        assertEquals(PipelinePhase.EMBED, progress.phase());
        assertEquals(75, progress.progressPct());
        assertNotNull(progress.startedAt());
        assertNull(progress.finishedAt());
        assertEquals(3, progress.eventCount());
        assertEquals(List.of(JobEventType.JOB_QUEUED, JobEventType.JOB_RUNNING, JobEventType.PHASE_COMPLETED),
                     progress.timeline().stream().map(TimelineEntry::eventType).toList());
        assertEquals(Map.of("embedded", 2), progress.timeline().get(2).payload());
    }

    @Test
    void getJobProgress_failedJobKeepsPhaseAndError() {
        IndexingJob job = jobStore.create(UUID.randomUUID(), UUID.randomUUID(), null, false);
        jobStore.markRunning(job);
        jobStore.updatePhase(job, PipelinePhase.CHUNK);
        jobStore.markFailed(job, "embed phase failed: quota");

        JobProgress progress = jobProgressService.getJobProgress(job.getJobId());

        assertEquals(JobStatus.FAILED, progress.status());
        assertEquals(PipelinePhase.CHUNK, progress.phase());
        assertEquals(55, progress.progressPct());
        assertEquals("embed phase failed: quota", progress.errorMessage());
        assertNotNull(progress.finishedAt());
    }

    @Test
    void getJobProgress_unknownJob_throws() {
        UUID unknown = UUID.randomUUID();
        assertThrows(JobNotFoundException.class, () -> jobProgressService.getJobProgress(unknown));
    }

    @Test
    void listProjectJobs_omitsTimelines() {
        UUID projectId = UUID.randomUUID();
        IndexingJob job = jobStore.create(projectId, UUID.randomUUID(), null, false);
        jobEventLog.append(job.getJobId(), JobEventType.JOB_QUEUED, PipelinePhase.CONVERT, 0, "Job queued", null);

        List<JobProgress> jobs = jobProgressService.listProjectJobs(projectId, 10, 0);

        assertEquals(1, jobs.size());
        assertEquals(job.getJobId(), jobs.get(0).jobId());
        assertTrue(jobs.get(0).timeline().isEmpty());
        assertEquals(0, jobs.get(0).eventCount());
    }
}
