package com.eyelevel.documentindexer.service.job;

import com.eyelevel.documentindexer.model.IndexingJob;
import com.eyelevel.documentindexer.model.JobEvent;
import com.eyelevel.documentindexer.model.JobEventType;
import com.eyelevel.documentindexer.model.PipelinePhase;
import com.eyelevel.documentindexer.repository.IndexingJobRepository;
import com.eyelevel.documentindexer.repository.JobEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only timeline of a job. Events are written in the caller's transaction and flushed so the
 * next sequence number is always computed against everything written so far.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobEventLog {

    private final JobEventRepository jobEventRepository;
    private final IndexingJobRepository indexingJobRepository;

    public JobEvent append(UUID jobId, JobEventType eventType, @Nullable PipelinePhase phase,
                           @Nullable Integer progressPct, String message, @Nullable Map<String, Object> payload) {
        IndexingJob jobReference = indexingJobRepository.getReferenceById(jobId);
        int sequenceNo = jobEventRepository.findMaxSequenceNo(jobId) + 1;

        JobEvent event = JobEvent.builder()
                                 .job(jobReference)
                                 .sequenceNo(sequenceNo)
                                 .eventType(eventType)
                                 .phase(phase)
                                 .progressPct(progressPct)
                                 .message(truncate(message))
                                 .payload(payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload))
                                 .build();
        JobEvent saved = jobEventRepository.saveAndFlush(event);
        log.debug("[JobId: {}] Event #{} {} (phase={}, progress={})", jobId, sequenceNo, eventType, phase,
                  progressPct);
        return saved;
    }

    public JobEvent phaseStarted(UUID jobId, PipelinePhase phase, int progressPct, String message) {
        return append(jobId, JobEventType.PHASE_STARTED, phase, progressPct, message, null);
    }

    public JobEvent phaseCompleted(UUID jobId, PipelinePhase phase, int progressPct, String message,
                                   @Nullable Map<String, Object> payload) {
        return append(jobId, JobEventType.PHASE_COMPLETED, phase, progressPct, message, payload);
    }

    public JobEvent phaseFailed(UUID jobId, PipelinePhase phase, int progressPct, Throwable error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", String.valueOf(error.getMessage()));
        payload.put("error_type", error.getClass().getSimpleName());
        return append(jobId, JobEventType.PHASE_FAILED, phase, progressPct,
                      phase.wireName() + " failed: " + error.getMessage(), payload);
    }

    /**
     * Events of the job in the order they were written.
     */
    public List<JobEvent> timeline(UUID jobId) {
        return jobEventRepository.findByJob_JobIdOrderBySequenceNoAsc(jobId);
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= JobEvent.MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, JobEvent.MAX_MESSAGE_LENGTH - 3) + "...";
    }
}
