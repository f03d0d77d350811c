package com.eyelevel.documentindexer.model;

/**
 * Kinds of entries written to a job's timeline.
 */
public enum JobEventType {
    JOB_QUEUED,
    JOB_RUNNING,
    PHASE_STARTED,
    PHASE_COMPLETED,
    PHASE_FAILED,
    /**
     * Active embedding count and chunk count disagreed at integration time. Diagnostic only.
     */
    INTEGRITY_WARNING,
    JOB_COMPLETED,
    JOB_FAILED
}
