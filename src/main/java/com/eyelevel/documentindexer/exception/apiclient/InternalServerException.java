package com.eyelevel.documentindexer.exception.apiclient;

import java.io.Serial;

/**
 * The provider failed internally (HTTP 500). Retried.
 */
public class InternalServerException extends ApiException {

    @Serial
    private static final long serialVersionUID = 1192849301724467718L;

    public InternalServerException(String message) {
        super(message, 500);
    }
}
