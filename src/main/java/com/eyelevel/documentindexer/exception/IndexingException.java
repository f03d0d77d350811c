package com.eyelevel.documentindexer.exception;

import java.io.Serial;

/**
 * Base exception for errors raised while indexing a document.
 */
public class IndexingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public IndexingException(String message) {
        super(message);
    }

    public IndexingException(String message, Throwable cause) {
        super(message, cause);
    }
}
