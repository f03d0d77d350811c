package com.eyelevel.documentindexer.exception;

import java.io.Serial;

/**
 * Thrown when a job submission is missing a required collaborator or argument. Raised before any job
 * row is written, so there is nothing to compensate.
 */
public class IndexingPreconditionException extends IndexingException {
    @Serial
    private static final long serialVersionUID = -2291544068911823097L;

    public IndexingPreconditionException(String message) {
        super(message);
    }
}
