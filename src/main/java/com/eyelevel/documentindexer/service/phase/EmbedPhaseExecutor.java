package com.eyelevel.documentindexer.service.phase;

import com.eyelevel.documentindexer.config.IndexingPipelineConfig;
import com.eyelevel.documentindexer.exception.EmbeddingValidationException;
import com.eyelevel.documentindexer.exception.PhaseExecutionException;
import com.eyelevel.documentindexer.model.DocumentChunk;
import com.eyelevel.documentindexer.model.PipelinePhase;
import com.eyelevel.documentindexer.service.chunk.ChunkStore;
import com.eyelevel.documentindexer.service.embedding.EmbeddingModelCatalog;
import com.eyelevel.documentindexer.service.embedding.EmbeddingProvider;
import com.eyelevel.documentindexer.service.embedding.EmbeddingStore;
import com.eyelevel.documentindexer.service.job.JobEventLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Computes embeddings for the selected chunks of a file. Chunks that already have an active
 * embedding for the model are skipped, so the phase can be re-run after a partial failure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbedPhaseExecutor {

    private final ChunkStore chunkStore;
    private final EmbeddingStore embeddingStore;
    private final EmbeddingProvider embeddingProvider;
    private final EmbeddingModelCatalog embeddingModelCatalog;
    private final JobEventLog jobEventLog;
    private final IndexingPipelineConfig indexingPipelineConfig;

    public EmbeddingResult generateEmbeddings(UUID jobId, UUID fileId, String embeddingModel, ChunkSelector selector,
                                              int dimension) {
        jobEventLog.phaseStarted(jobId, PipelinePhase.EMBED, 0, "Generating embeddings with " + embeddingModel);
        try {
            embeddingModelCatalog.validate(embeddingModel, dimension);
            int totalChunks = Math.toIntExact(chunkStore.countByFile(fileId));

            List<DocumentChunk> pending = select(fileId, selector).stream()
                                                                  .filter(chunk -> !embeddingStore.existsActive(
                                                                          fileId, chunk.getChunkIndex(),
                                                                          embeddingModel))
                                                                  .toList();
            int embedded = embedInBatches(jobId, pending, embeddingModel, dimension);
            EmbeddingResult result = new EmbeddingResult(totalChunks, embedded);
            log.info("[JobId: {}, FileId: {}] Embedded {} chunks, skipped {} of {}.", jobId, fileId, embedded,
                     result.skipped(), totalChunks);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("embedded", result.embedded());
            payload.put("skipped", result.skipped());
            payload.put("model", embeddingModel);
            payload.put("dimension", dimension);
            jobEventLog.phaseCompleted(jobId, PipelinePhase.EMBED, 100, "Embedded " + embedded + " chunks", payload);
            return result;
        } catch (Exception e) {
            log.error("[JobId: {}, FileId: {}] Embed phase failed.", jobId, fileId, e);
            try {
                jobEventLog.phaseFailed(jobId, PipelinePhase.EMBED, 0, e);
            } catch (RuntimeException eventError) {
                log.error("[JobId: {}] Could not record the embed failure event.", jobId, eventError);
                e.addSuppressed(eventError);
            }
            throw PhaseExecutionException.wrap(PipelinePhase.EMBED, e);
        }
    }

    private List<DocumentChunk> select(UUID fileId, ChunkSelector selector) {
        return switch (selector.mode()) {
            case ALL -> chunkStore.listByFile(fileId);
            case CHUNK_IDS -> chunkStore.listByIds(fileId, selector.chunkIds());
            case INDEX_RANGE -> chunkStore.listByIndexRange(fileId, selector.startIndex(), selector.endIndex());
        };
    }

    private int embedInBatches(UUID jobId, List<DocumentChunk> pending, String embeddingModel, int dimension) {
        int batchSize = Math.max(1, indexingPipelineConfig.getEmbedding().getBatchSize());
        int embedded = 0;
        for (int start = 0; start < pending.size(); start += batchSize) {
            List<DocumentChunk> batch = pending.subList(start, Math.min(start + batchSize, pending.size()));
            List<float[]> vectors = embeddingProvider.generateEmbeddings(
                    batch.stream().map(DocumentChunk::getChunkText).toList(), embeddingModel, dimension);
            if (vectors.size() != batch.size()) {
                throw new EmbeddingValidationException(
                        "Provider returned " + vectors.size() + " vectors for " + batch.size() + " chunks");
            }
            for (int i = 0; i < batch.size(); i++) {
                embeddingStore.store(batch.get(i), embeddingModel, vectors.get(i));
            }
            embeddingStore.flush();
            embedded += batch.size();
            log.debug("[JobId: {}] Embedded batch of {} chunks ({} so far).", jobId, batch.size(), embedded);
        }
        return embedded;
    }
}
