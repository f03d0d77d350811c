package com.eyelevel.documentindexer.service.phase;

import com.eyelevel.documentindexer.exception.PhaseExecutionException;
import com.eyelevel.documentindexer.model.JobEventType;
import com.eyelevel.documentindexer.model.PipelinePhase;
import com.eyelevel.documentindexer.service.chunk.ChunkStore;
import com.eyelevel.documentindexer.service.embedding.EmbeddingStore;
import com.eyelevel.documentindexer.service.job.JobEventLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Publishes a file's active embeddings to the vector index and checks that every chunk has one.
 * A mismatch is reported as an {@link JobEventType#INTEGRITY_WARNING} and never fails the job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntegratePhaseExecutor {

    private final ChunkStore chunkStore;
    private final EmbeddingStore embeddingStore;
    private final JobEventLog jobEventLog;

    public IntegrationResult integrateVectorIndex(UUID jobId, UUID fileId) {
        jobEventLog.phaseStarted(jobId, PipelinePhase.INTEGRATE, 80, "Integrating vector index");
        try {
            long totalChunks = chunkStore.countByFile(fileId);
            long activeEmbeddings = embeddingStore.countByFile(fileId, true);
            boolean ready = activeEmbeddings > 0;
            boolean integrityValid = activeEmbeddings == totalChunks;

            if (!integrityValid) {
                log.warn("[JobId: {}, FileId: {}] {} active embeddings for {} chunks.", jobId, fileId,
                         activeEmbeddings, totalChunks);
                Map<String, Object> warning = new LinkedHashMap<>();
                warning.put("active_embeddings", activeEmbeddings);
                warning.put("total_chunks", totalChunks);
                jobEventLog.append(jobId, JobEventType.INTEGRITY_WARNING, PipelinePhase.INTEGRATE, 80,
                                   "Embedding count does not match chunk count", warning);
            }

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("active_embeddings", activeEmbeddings);
            payload.put("total_chunks", totalChunks);
            payload.put("integrity_valid", integrityValid);
            payload.put("ready", ready);
            jobEventLog.phaseCompleted(jobId, PipelinePhase.INTEGRATE, 90, "Vector index integrated", payload);
            return new IntegrationResult(0, 0, ready, integrityValid);
        } catch (Exception e) {
            log.error("[JobId: {}, FileId: {}] Integrate phase failed.", jobId, fileId, e);
            try {
                jobEventLog.phaseFailed(jobId, PipelinePhase.INTEGRATE, 80, e);
            } catch (RuntimeException eventError) {
                log.error("[JobId: {}] Could not record the integrate failure event.", jobId, eventError);
                e.addSuppressed(eventError);
            }
            throw PhaseExecutionException.wrap(PipelinePhase.INTEGRATE, e);
        }
    }
}
