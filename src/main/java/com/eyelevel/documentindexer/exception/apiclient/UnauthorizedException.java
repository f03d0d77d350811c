package com.eyelevel.documentindexer.exception.apiclient;

import java.io.Serial;

/**
 * The provider rejected the configured credentials (HTTP 401).
 */
public class UnauthorizedException extends ApiException {

    @Serial
    private static final long serialVersionUID = 5904188233913625062L;

    public UnauthorizedException(String message) {
        super(message, 401);
    }
}
