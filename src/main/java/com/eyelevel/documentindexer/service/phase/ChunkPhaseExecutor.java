package com.eyelevel.documentindexer.service.phase;

import com.eyelevel.documentindexer.exception.PhaseExecutionException;
import com.eyelevel.documentindexer.model.DocumentChunk;
import com.eyelevel.documentindexer.model.PipelinePhase;
import com.eyelevel.documentindexer.service.chunk.ChunkStore;
import com.eyelevel.documentindexer.service.chunk.TextChunk;
import com.eyelevel.documentindexer.service.chunk.TextChunker;
import com.eyelevel.documentindexer.service.job.JobEventLog;
import com.eyelevel.documentindexer.service.storage.StorageAccessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Splits the document text into overlapping token windows and replaces the file's stored chunks
 * with the new set. Running it twice on the same text leaves the same chunks behind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChunkPhaseExecutor {

    private final StorageAccessor storageAccessor;
    private final TextChunker textChunker;
    private final ChunkStore chunkStore;
    private final JobEventLog jobEventLog;

    public ChunkingResult chunkText(UUID jobId, UUID fileId, String textUri, ChunkParams params) {
        jobEventLog.phaseStarted(jobId, PipelinePhase.CHUNK, 40, "Chunking text");
        try {
            String text = new String(storageAccessor.read(textUri), StandardCharsets.UTF_8);
            if (text.isBlank()) {
                throw new PhaseExecutionException(PipelinePhase.CHUNK, "No text to chunk in " + textUri);
            }

            List<TextChunk> chunks = textChunker.split(text, params.maxTokens(), params.overlap());
            List<DocumentChunk> stored = chunkStore.replaceChunks(fileId, chunks);
            ChunkingResult result = new ChunkingResult(stored.size(),
                                                       stored.stream().map(DocumentChunk::getChunkId).toList());
            log.info("[JobId: {}, FileId: {}] Stored {} chunks (maxTokens={}, overlap={}).", jobId, fileId,
                     result.totalChunks(), params.maxTokens(), params.overlap());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("total_chunks", result.totalChunks());
            payload.put("max_tokens", params.maxTokens());
            payload.put("overlap", params.overlap());
            jobEventLog.phaseCompleted(jobId, PipelinePhase.CHUNK, 50, "Created " + result.totalChunks() + " chunks",
                                       payload);
            return result;
        } catch (Exception e) {
            log.error("[JobId: {}, FileId: {}] Chunk phase failed.", jobId, fileId, e);
            try {
                jobEventLog.phaseFailed(jobId, PipelinePhase.CHUNK, 40, e);
            } catch (RuntimeException eventError) {
                log.error("[JobId: {}] Could not record the chunk failure event.", jobId, eventError);
                e.addSuppressed(eventError);
            }
            throw PhaseExecutionException.wrap(PipelinePhase.CHUNK, e);
        }
    }
}
