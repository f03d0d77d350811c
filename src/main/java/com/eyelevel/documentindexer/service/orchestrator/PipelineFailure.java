package com.eyelevel.documentindexer.service.orchestrator;

import com.eyelevel.documentindexer.model.PipelinePhase;

/**
 * Where and why a pipeline stopped.
 *
 * @param phase     the phase that was running, or the last completed one for failures between phases.
 * @param errorType simple class name of the underlying exception.
 */
public record PipelineFailure(PipelinePhase phase, String errorType, String message) {
}
