package com.eyelevel.documentindexer.exception.apiclient;

import java.io.Serial;

/**
 * The provider or the client timed out (HTTP 504). Retried.
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = -5118840612095328821L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }
}
