package com.eyelevel.documentindexer.exception;

import java.io.Serial;

public class StorageAccessException extends IndexingException {
    @Serial
    private static final long serialVersionUID = 5502879116093017652L;

    public StorageAccessException(String message) {
        super(message);
    }

    public StorageAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
