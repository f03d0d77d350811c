package com.eyelevel.documentindexer.exception.apiclient;

import java.io.Serial;

/**
 * The provider is unavailable or could not be reached (HTTP 503). Retried.
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = 6652095178814523380L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }
}
