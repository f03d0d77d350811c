package com.eyelevel.documentindexer.service.progress;

import com.eyelevel.documentindexer.model.JobEvent;
import com.eyelevel.documentindexer.model.JobEventType;
import com.eyelevel.documentindexer.model.PipelinePhase;

import java.time.LocalDateTime;
import java.util.Map;

public record TimelineEntry(int sequenceNo, JobEventType eventType, PipelinePhase phase, Integer progressPct,
                            String message, Map<String, Object> payload, LocalDateTime createdAt) {

    static TimelineEntry from(JobEvent event) {
        return new TimelineEntry(event.getSequenceNo(), event.getEventType(), event.getPhase(),
                                 event.getProgressPct(), event.getMessage(), event.getPayload(),
                                 event.getCreatedAt());
    }
}
