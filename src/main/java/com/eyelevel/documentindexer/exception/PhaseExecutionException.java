package com.eyelevel.documentindexer.exception;

import com.eyelevel.documentindexer.model.PipelinePhase;
import lombok.Getter;

import java.io.Serial;

/**
 * Wraps any failure inside a pipeline phase and remembers which phase it was.
 */
@Getter
public class PhaseExecutionException extends IndexingException {
    @Serial
    private static final long serialVersionUID = 7519003021754488931L;

    private final PipelinePhase phase;

    public PhaseExecutionException(PipelinePhase phase, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
    }

    public PhaseExecutionException(PipelinePhase phase, String message) {
        super(message);
        this.phase = phase;
    }

    /**
     * Attributes {@code error} to {@code phase}. An error that already carries a phase is returned as is.
     */
    public static PhaseExecutionException wrap(PipelinePhase phase, Throwable error) {
        if (error instanceof PhaseExecutionException phaseError) {
            return phaseError;
        }
        return new PhaseExecutionException(phase, phase.wireName() + " phase failed: " + error.getMessage(), error);
    }

    /**
     * Type of the underlying failure, as reported in job summaries and events.
     */
    public String errorType() {
        Throwable cause = getCause();
        return cause != null ? cause.getClass().getSimpleName() : getClass().getSimpleName();
    }
}
