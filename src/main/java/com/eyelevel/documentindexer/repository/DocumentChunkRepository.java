package com.eyelevel.documentindexer.repository;

import com.eyelevel.documentindexer.model.DocumentChunk;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA repository for the {@link DocumentChunk} entity.
 */
@Repository
public interface DocumentChunkRepository extends JpaRepository<DocumentChunk, UUID> {

    List<DocumentChunk> findByFileIdOrderByChunkIndexAsc(UUID fileId);

    List<DocumentChunk> findByFileIdAndChunkIndexBetweenOrderByChunkIndexAsc(UUID fileId, int start, int end);

    List<DocumentChunk> findByChunkIdInOrderByChunkIndexAsc(Collection<UUID> chunkIds);

    long countByFileId(UUID fileId);

    /**
     * Bulk-deletes every chunk of a file. Runs as a single statement so the delete reaches the
     * database before the replacement set is inserted under the same unique key.
     */
    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM DocumentChunk c WHERE c.fileId = :fileId")
    int deleteByFileId(@Param("fileId") UUID fileId);
}
