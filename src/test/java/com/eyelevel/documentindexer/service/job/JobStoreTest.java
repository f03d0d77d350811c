package com.eyelevel.documentindexer.service.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.eyelevel.documentindexer.exception.JobNotFoundException;
import com.eyelevel.documentindexer.model.IndexingJob;
import com.eyelevel.documentindexer.model.JobStatus;
import com.eyelevel.documentindexer.model.PipelinePhase;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

/**
 * Exercises job state transitions against an embedded database.
 */
@DataJpaTest
@Import(JobStore.class)
class JobStoreTest {

    @Autowired
    private JobStore jobStore;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void create_startsQueuedAtConvert() {
        IndexingJob job = jobStore.create(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), true);

        assertNotNull(job.getJobId());
        assertEquals(JobStatus.QUEUED, job.getStatus());
        assertEquals(PipelinePhase.CONVERT, job.getPhaseCurrent());
        assertEquals(0, job.getProgressPct());
        assertNull(job.getStartedAt());
    }

    @Test
    void transitions_areVisibleAfterReload() {
        IndexingJob job = jobStore.create(UUID.randomUUID(), UUID.randomUUID(), null, false);

        jobStore.markRunning(job);
        jobStore.updatePhase(job, PipelinePhase.CHUNK);
        entityManager.clear();

        IndexingJob reloaded = jobStore.getById(job.getJobId());
        assertEquals(JobStatus.RUNNING, reloaded.getStatus());
        assertEquals(PipelinePhase.CHUNK, reloaded.getPhaseCurrent());
        assertEquals(55, reloaded.getProgressPct());
        assertNotNull(reloaded.getStartedAt());
    }

    @Test
    void markCompleted_movesToReadyWithFullProgress() {
        IndexingJob job = jobStore.create(UUID.randomUUID(), UUID.randomUUID(), null, false);
        jobStore.markRunning(job);

        IndexingJob completed = jobStore.markCompleted(job);

        assertEquals(JobStatus.COMPLETED, completed.getStatus());
        assertEquals(PipelinePhase.READY, completed.getPhaseCurrent());
        assertEquals(100, completed.getProgressPct());
        assertNotNull(completed.getCompletedAt());
    }

    @Test
    void markFailed_keepsCurrentPhaseAndRecordsError() {
        IndexingJob job = jobStore.create(UUID.randomUUID(), UUID.randomUUID(), null, false);
        jobStore.markRunning(job);
        jobStore.updatePhase(job, PipelinePhase.CHUNK);

        IndexingJob failed = jobStore.markFailed(job, "embed phase failed: provider down");

        assertEquals(JobStatus.FAILED, failed.getStatus());
        assertEquals(PipelinePhase.CHUNK, failed.getPhaseCurrent());
        assertEquals("embed phase failed: provider down", failed.getErrorMessage());
        assertNotNull(failed.getFailedAt());
    }

    @Test
    void getById_unknownJob_throws() {
        UUID unknown = UUID.randomUUID();
        assertThrows(JobNotFoundException.class, () -> jobStore.getById(unknown));
    }

    @Test
    void listByProject_appliesLimitAndOffset() {
        UUID projectId = UUID.randomUUID();
        for (int i = 0; i < 3; i++) {
            jobStore.create(projectId, UUID.randomUUID(), null, false);
        }
        jobStore.create(UUID.randomUUID(), UUID.randomUUID(), null, false);

        assertEquals(2, jobStore.listByProject(projectId, 2, 0).size());
        assertEquals(1, jobStore.listByProject(projectId, 5, 2).size());
        assertThrows(IllegalArgumentException.class, () -> jobStore.listByProject(projectId, 0, 0));
    }
}
