package com.eyelevel.documentindexer.service.embedding;

import com.eyelevel.documentindexer.model.DocumentChunk;
import com.eyelevel.documentindexer.model.DocumentEmbedding;
import com.eyelevel.documentindexer.repository.DocumentEmbeddingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Persistence of embedding vectors. At most one row exists per (file, chunk index, model); inactive
 * rows are logically deleted and get revived instead of duplicated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingStore {

    private final DocumentEmbeddingRepository documentEmbeddingRepository;

    public boolean existsActive(UUID fileId, int chunkIndex, String embeddingModel) {
        return documentEmbeddingRepository.existsByFileIdAndChunkIndexAndEmbeddingModelAndActiveTrue(
                fileId, chunkIndex, embeddingModel);
    }

    /**
     * Stores the vector computed for {@code chunk}. An inactive row under the same key is reactivated
     * with the new vector.
     */
    public DocumentEmbedding store(DocumentChunk chunk, String embeddingModel, float[] vector) {
        DocumentEmbedding embedding = documentEmbeddingRepository
                .findByFileIdAndChunkIndexAndEmbeddingModel(chunk.getFileId(), chunk.getChunkIndex(), embeddingModel)
                .map(existing -> {
                    log.debug("[FileId: {}] Reviving inactive embedding for chunk {}.", chunk.getFileId(),
                              chunk.getChunkIndex());
                    existing.setActive(true);
                    existing.setDeactivatedAt(null);
                    return existing;
                })
                .orElseGet(() -> DocumentEmbedding.builder()
                                                  .fileId(chunk.getFileId())
                                                  .chunkIndex(chunk.getChunkIndex())
                                                  .embeddingModel(embeddingModel)
                                                  .build());
        embedding.setChunkId(chunk.getChunkId());
        embedding.setDimension(vector.length);
        embedding.setVector(vector);
        return documentEmbeddingRepository.save(embedding);
    }

    public void flush() {
        documentEmbeddingRepository.flush();
    }

    public long countByFile(UUID fileId, boolean onlyActive) {
        return onlyActive
                ? documentEmbeddingRepository.countByFileIdAndActiveTrue(fileId)
                : documentEmbeddingRepository.countByFileId(fileId);
    }

    public List<DocumentEmbedding> listByFile(UUID fileId) {
        return documentEmbeddingRepository.findByFileIdOrderByChunkIndexAsc(fileId);
    }

    /**
     * Logically deletes every active embedding of the file.
     *
     * @return the number of rows deactivated.
     */
    public int markInactive(UUID fileId) {
        int deactivated = documentEmbeddingRepository.deactivateByFileId(fileId, LocalDateTime.now());
        log.info("[FileId: {}] Deactivated {} embeddings.", fileId, deactivated);
        return deactivated;
    }
}
