package com.eyelevel.documentindexer.model;

/**
 * Macro lifecycle of an {@link IndexingJob}. Independent of the pipeline position tracked by
 * {@link PipelinePhase}: a job can be {@code RUNNING} while its current phase is {@code EMBED}.
 */
public enum JobStatus {
    /**
     * The job row exists but credits have not been reserved yet.
     */
    QUEUED,
    /**
     * Credits are reserved and the pipeline is executing.
     */
    RUNNING,
    /**
     * Every phase finished and the reservation was consumed.
     */
    COMPLETED,
    /**
     * A phase raised an error; the reservation was released.
     */
    FAILED,
    /**
     * Reserved for operator cancellation. The pipeline never sets it itself.
     */
    CANCELLED;

    public boolean isTerminal() {
        return switch (this) {
            case QUEUED, RUNNING -> false;
            case COMPLETED, FAILED, CANCELLED -> true;
        };
    }
}
