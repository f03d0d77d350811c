package com.eyelevel.documentindexer.exception.apiclient;

import java.io.Serial;

/**
 * An upstream gateway failed (HTTP 502). Retried.
 */
public class BadGatewayException extends ApiException {

    @Serial
    private static final long serialVersionUID = -3391067155408731124L;

    public BadGatewayException(String message) {
        super(message, 502);
    }
}
