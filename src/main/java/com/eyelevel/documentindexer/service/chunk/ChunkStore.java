package com.eyelevel.documentindexer.service.chunk;

import com.eyelevel.documentindexer.model.DocumentChunk;
import com.eyelevel.documentindexer.repository.DocumentChunkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Persistence of a file's chunk set. Writing is always a full replacement, never a merge.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChunkStore {

    private final DocumentChunkRepository documentChunkRepository;

    /**
     * Deletes every existing chunk of the file and inserts {@code chunks} with indexes 0..n-1.
     *
     * @return the persisted chunks in index order.
     */
    public List<DocumentChunk> replaceChunks(UUID fileId, List<TextChunk> chunks) {
        int removed = documentChunkRepository.deleteByFileId(fileId);
        if (removed > 0) {
            log.info("[FileId: {}] Removed {} existing chunks before re-chunking.", fileId, removed);
        }

        List<DocumentChunk> records = new ArrayList<>(chunks.size());
        for (int index = 0; index < chunks.size(); index++) {
            TextChunk chunk = chunks.get(index);
            records.add(DocumentChunk.builder()
                                     .fileId(fileId)
                                     .chunkIndex(index)
                                     .chunkText(chunk.text())
                                     .tokenCount(chunk.tokenCount())
                                     .build());
        }
        List<DocumentChunk> saved = documentChunkRepository.saveAllAndFlush(records);
        log.debug("[FileId: {}] Persisted {} chunks.", fileId, saved.size());
        return saved;
    }

    public List<DocumentChunk> listByFile(UUID fileId) {
        return documentChunkRepository.findByFileIdOrderByChunkIndexAsc(fileId);
    }

    /**
     * Chunks of the file whose index lies in {@code [start, end]}, both inclusive.
     */
    public List<DocumentChunk> listByIndexRange(UUID fileId, int start, int end) {
        return documentChunkRepository.findByFileIdAndChunkIndexBetweenOrderByChunkIndexAsc(fileId, start, end);
    }

    /**
     * Chunks with the given ids that belong to {@code fileId}. Unknown ids and chunks of other files are
     * ignored.
     */
    public List<DocumentChunk> listByIds(UUID fileId, Collection<UUID> chunkIds) {
        return documentChunkRepository.findByChunkIdInOrderByChunkIndexAsc(chunkIds)
                                      .stream()
                                      .filter(chunk -> fileId.equals(chunk.getFileId()))
                                      .toList();
    }

    public long countByFile(UUID fileId) {
        return documentChunkRepository.countByFileId(fileId);
    }
}
