package com.eyelevel.documentindexer.repository;

import com.eyelevel.documentindexer.model.JobEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA repository for timeline entries. Only inserts and reads are exposed by callers.
 */
@Repository
public interface JobEventRepository extends JpaRepository<JobEvent, UUID> {

    List<JobEvent> findByJob_JobIdOrderBySequenceNoAsc(UUID jobId);

    /**
     * Returns the highest sequence number written for the job, or 0 when the timeline is empty.
     */
    @Query("SELECT COALESCE(MAX(e.sequenceNo), 0) FROM JobEvent e WHERE e.job.jobId = :jobId")
    int findMaxSequenceNo(@Param("jobId") UUID jobId);
}
