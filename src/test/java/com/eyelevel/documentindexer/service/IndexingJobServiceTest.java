package com.eyelevel.documentindexer.service;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.eyelevel.documentindexer.exception.IndexingPreconditionException;
import com.eyelevel.documentindexer.model.JobStatus;
import com.eyelevel.documentindexer.model.PipelinePhase;
import com.eyelevel.documentindexer.service.embedding.EmbeddingStore;
import com.eyelevel.documentindexer.service.job.FileIndexingLock;
import com.eyelevel.documentindexer.service.orchestrator.IndexingOrchestrator;
import com.eyelevel.documentindexer.service.orchestrator.IndexingRequest;
import com.eyelevel.documentindexer.service.orchestrator.OrchestrationSummary;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

/**
 * Transaction and ordering behaviour of the indexing entry points.
 */
class IndexingJobServiceTest {

    private IndexingOrchestrator orchestrator;
    private EmbeddingStore embeddingStore;
    private PlatformTransactionManager transactionManager;
    private IndexingJobService service;
    private IndexingRequest request;
    private OrchestrationSummary summary;

    @BeforeEach
    void setUp() {
        orchestrator = mock(IndexingOrchestrator.class);
        embeddingStore = mock(EmbeddingStore.class);
        transactionManager = mock(PlatformTransactionManager.class);
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        service = new IndexingJobService(orchestrator, embeddingStore, new FileIndexingLock(4), transactionManager,
                                         new SimpleAsyncTaskExecutor("indexing-test-"));

        request = new IndexingRequest(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), "text/plain", false,
                                      null, "uploads/doc.txt");
        summary = new OrchestrationSummary(UUID.randomUUID(), List.of(PipelinePhase.CONVERT, PipelinePhase.READY),
                                           JobStatus.COMPLETED, 1, 1, 35, 1L, null);
        when(orchestrator.runIndexingJob(request)).thenReturn(summary);
    }

    @Test
    void submit_runsPipelineInsideCommittedTransaction() {
        assertSame(summary, service.submit(request));

        InOrder order = inOrder(transactionManager, orchestrator);
        order.verify(transactionManager).getTransaction(any());
        order.verify(orchestrator).runIndexingJob(request);
        order.verify(transactionManager).commit(any(TransactionStatus.class));
        verify(embeddingStore, never()).markInactive(any());
    }

    @Test
    void reindex_deactivatesEmbeddingsBeforeRunning() {
        assertSame(summary, service.reindex(request));

        InOrder order = inOrder(embeddingStore, orchestrator, transactionManager);
        order.verify(embeddingStore).markInactive(request.fileId());
        order.verify(orchestrator).runIndexingJob(request);
        order.verify(transactionManager).commit(any(TransactionStatus.class));
    }

    @Test
    void submitAsync_completesWithSummary() throws Exception {
        assertSame(summary, service.submitAsync(request).get(5, TimeUnit.SECONDS));
    }

    @Test
    void submit_withoutFileId_isRejectedBeforeLocking() {
        IndexingRequest noFile = new IndexingRequest(UUID.randomUUID(), null, UUID.randomUUID(), "text/plain", false,
                                                     null, "uploads/doc.txt");

        assertThrows(IndexingPreconditionException.class, () -> service.submit(noFile));
        verify(transactionManager, never()).getTransaction(any());
        verify(orchestrator, never()).runIndexingJob(any());
    }

    @Test
    void submitAsync_nullRequest_isRejectedOnCallingThread() {
        assertThrows(IndexingPreconditionException.class, () -> service.submitAsync(null));
        verify(orchestrator, never()).runIndexingJob(any());
    }

    @Test
    void reindex_invalidSourceUri_deactivatesNothing() {
        IndexingRequest badUri = new IndexingRequest(request.projectId(), request.fileId(), request.userId(),
                                                     "text/plain", false, null, "no-separator");

        assertThrows(IndexingPreconditionException.class, () -> service.reindex(badUri));
        verify(embeddingStore, never()).markInactive(any());
        verify(transactionManager, never()).getTransaction(any());
        verify(orchestrator, never()).runIndexingJob(any());
    }

    @Test
    void reindex_nullRequest_deactivatesNothing() {
        assertThrows(IndexingPreconditionException.class, () -> service.reindex(null));
        verify(embeddingStore, never()).markInactive(any());
    }
}
