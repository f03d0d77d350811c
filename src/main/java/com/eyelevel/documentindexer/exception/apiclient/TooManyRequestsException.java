package com.eyelevel.documentindexer.exception.apiclient;

import java.io.Serial;

/**
 * The provider is rate limiting this client (HTTP 429). Retried.
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = -6576126133407459351L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }
}
