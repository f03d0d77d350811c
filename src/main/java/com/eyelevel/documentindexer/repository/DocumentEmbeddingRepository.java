package com.eyelevel.documentindexer.repository;

import com.eyelevel.documentindexer.model.DocumentEmbedding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA repository for the {@link DocumentEmbedding} entity.
 */
@Repository
public interface DocumentEmbeddingRepository extends JpaRepository<DocumentEmbedding, UUID> {

    boolean existsByFileIdAndChunkIndexAndEmbeddingModelAndActiveTrue(UUID fileId, int chunkIndex,
                                                                      String embeddingModel);

    Optional<DocumentEmbedding> findByFileIdAndChunkIndexAndEmbeddingModel(UUID fileId, int chunkIndex,
                                                                           String embeddingModel);

    List<DocumentEmbedding> findByFileIdOrderByChunkIndexAsc(UUID fileId);

    long countByFileId(UUID fileId);

    long countByFileIdAndActiveTrue(UUID fileId);

    /**
     * Logically deletes all active embeddings of a file. Clears the persistence context afterwards so
     * no managed embedding keeps a stale active flag.
     *
     * @return the number of rows switched to inactive.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DocumentEmbedding e SET e.active = false, e.deactivatedAt = :deactivatedAt "
           + "WHERE e.fileId = :fileId AND e.active = true")
    int deactivateByFileId(@Param("fileId") UUID fileId, @Param("deactivatedAt") LocalDateTime deactivatedAt);
}
