package com.eyelevel.documentindexer.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Error returned by, or raised while calling, an external provider API. Carries the HTTP status
 * code so callers can tell transient failures from terminal ones.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4830840555831897529L;
    private final int statusCode;

    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * Rate limits and server-side errors are worth retrying; everything else is not.
     */
    public boolean isTransient() {
        return statusCode == 429 || statusCode >= 500;
    }
}
