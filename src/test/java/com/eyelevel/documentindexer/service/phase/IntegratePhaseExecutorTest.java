package com.eyelevel.documentindexer.service.phase;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.eyelevel.documentindexer.model.JobEventType;
import com.eyelevel.documentindexer.model.PipelinePhase;
import com.eyelevel.documentindexer.service.chunk.ChunkStore;
import com.eyelevel.documentindexer.service.embedding.EmbeddingStore;
import com.eyelevel.documentindexer.service.job.JobEventLog;
import java.util.UUID;
import org.junit.jupiter.api.Test;

/**
 * Verifies that integrity mismatches are reported but never fail integration.
 */
class IntegratePhaseExecutorTest {

    private final ChunkStore chunkStore = mock(ChunkStore.class);
    private final EmbeddingStore embeddingStore = mock(EmbeddingStore.class);
    private final JobEventLog jobEventLog = mock(JobEventLog.class);
    private final IntegratePhaseExecutor executor = new IntegratePhaseExecutor(chunkStore, embeddingStore, jobEventLog);

    private final UUID jobId = UUID.randomUUID();
    private final UUID fileId = UUID.randomUUID();

    @Test
    void integrateVectorIndex_isValidWhenEveryChunkHasAnActiveEmbedding() {
        when(chunkStore.countByFile(fileId)).thenReturn(10L);
        when(embeddingStore.countByFile(fileId, true)).thenReturn(10L);

        IntegrationResult result = executor.integrateVectorIndex(jobId, fileId);

        assertTrue(result.ready());
        assertTrue(result.integrityValid());
        verify(jobEventLog, never()).append(eq(jobId), eq(JobEventType.INTEGRITY_WARNING), any(), any(), anyString(),
                                            anyMap());
        verify(jobEventLog).phaseCompleted(eq(jobId), eq(PipelinePhase.INTEGRATE), eq(90), anyString(), anyMap());
    }

    @Test
    void integrateVectorIndex_warnsOnMismatchAndStillCompletes() {
        when(chunkStore.countByFile(fileId)).thenReturn(10L);
        when(embeddingStore.countByFile(fileId, true)).thenReturn(7L);

        IntegrationResult result = executor.integrateVectorIndex(jobId, fileId);

        assertTrue(result.ready());
        assertFalse(result.integrityValid());
        verify(jobEventLog).append(eq(jobId), eq(JobEventType.INTEGRITY_WARNING), eq(PipelinePhase.INTEGRATE),
                                   eq(80), anyString(), anyMap());
        verify(jobEventLog).phaseCompleted(eq(jobId), eq(PipelinePhase.INTEGRATE), eq(90), anyString(), anyMap());
    }

    @Test
    void integrateVectorIndex_reportsNotReadyWithoutActiveEmbeddings() {
        when(chunkStore.countByFile(fileId)).thenReturn(3L);
        when(embeddingStore.countByFile(fileId, true)).thenReturn(0L);

        IntegrationResult result = executor.integrateVectorIndex(jobId, fileId);

        assertFalse(result.ready());
        assertFalse(result.integrityValid());
    }
}
