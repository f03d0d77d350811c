package com.eyelevel.documentindexer.service;

import com.eyelevel.documentindexer.service.embedding.EmbeddingStore;
import com.eyelevel.documentindexer.service.job.FileIndexingLock;
import com.eyelevel.documentindexer.service.orchestrator.IndexingOrchestrator;
import com.eyelevel.documentindexer.service.orchestrator.IndexingRequest;
import com.eyelevel.documentindexer.service.orchestrator.OrchestrationSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point for indexing requests. Each run executes in its own transaction that commits when the
 * pipeline returns, whether the job completed or failed. Runs for the same file never overlap.
 */
@Slf4j
@Service
public class IndexingJobService {

    private final IndexingOrchestrator indexingOrchestrator;
    private final EmbeddingStore embeddingStore;
    private final FileIndexingLock fileIndexingLock;
    private final TransactionTemplate transactionTemplate;
    private final AsyncTaskExecutor taskExecutor;

    public IndexingJobService(IndexingOrchestrator indexingOrchestrator, EmbeddingStore embeddingStore,
                              FileIndexingLock fileIndexingLock, PlatformTransactionManager transactionManager,
                              @Qualifier("applicationTaskExecutor") AsyncTaskExecutor taskExecutor) {
        this.indexingOrchestrator = indexingOrchestrator;
        this.embeddingStore = embeddingStore;
        this.fileIndexingLock = fileIndexingLock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.taskExecutor = taskExecutor;
    }

    /**
     * Runs the pipeline for the request and commits its outcome.
     *
     * @throws com.eyelevel.documentindexer.exception.IndexingPreconditionException if the request is incomplete.
     */
    public OrchestrationSummary submit(IndexingRequest request) {
        IndexingRequest.requireValid(request);
        return fileIndexingLock.withLock(request.fileId(), () -> transactionTemplate.execute(
                status -> indexingOrchestrator.runIndexingJob(request)));
    }

    /**
     * Same as {@link #submit} on the indexing thread pool. Invalid requests are rejected on the calling thread.
     */
    public CompletableFuture<OrchestrationSummary> submitAsync(IndexingRequest request) {
        IndexingRequest.requireValid(request);
        log.info("[FileId: {}] Queuing indexing request for asynchronous execution.", request.fileId());
        return CompletableFuture.supplyAsync(() -> submit(request), taskExecutor);
    }

    /**
     * Indexes the file again from scratch. The file's current embeddings are deactivated first, so
     * every chunk is re-embedded with the configured model instead of being skipped.
     *
     * @throws com.eyelevel.documentindexer.exception.IndexingPreconditionException if the request is incomplete;
     *                                                                              nothing is deactivated then.
     */
    public OrchestrationSummary reindex(IndexingRequest request) {
        IndexingRequest.requireValid(request);
        return fileIndexingLock.withLock(request.fileId(), () -> transactionTemplate.execute(status -> {
            int deactivated = embeddingStore.markInactive(request.fileId());
            log.info("[FileId: {}] Reindexing file; {} previous embeddings deactivated.", request.fileId(),
                     deactivated);
            return indexingOrchestrator.runIndexingJob(request);
        }));
    }
}
