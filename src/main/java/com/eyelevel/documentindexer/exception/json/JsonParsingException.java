package com.eyelevel.documentindexer.exception.json;

import java.io.Serial;

/**
 * Thrown when JSON cannot be read from a provider response or a JSON column.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -4315221486898941505L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
