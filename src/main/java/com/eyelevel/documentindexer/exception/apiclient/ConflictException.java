package com.eyelevel.documentindexer.exception.apiclient;

import java.io.Serial;

/**
 * The provider reported a conflicting request (HTTP 409).
 */
public class ConflictException extends ApiException {

    @Serial
    private static final long serialVersionUID = -4931126370091527708L;

    public ConflictException(String message) {
        super(message, 409);
    }
}
