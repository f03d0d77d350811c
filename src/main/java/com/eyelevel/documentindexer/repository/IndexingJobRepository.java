package com.eyelevel.documentindexer.repository;

import com.eyelevel.documentindexer.model.IndexingJob;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA repository for the {@link IndexingJob} entity.
 */
@Repository
public interface IndexingJobRepository extends JpaRepository<IndexingJob, UUID> {

    /**
     * Lists the jobs of a project, newest first. Paging is driven by the supplied {@link Pageable}.
     */
    List<IndexingJob> findByProjectIdOrderByCreatedAtDesc(UUID projectId, Pageable pageable);
}
