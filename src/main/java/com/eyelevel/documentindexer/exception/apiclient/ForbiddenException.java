package com.eyelevel.documentindexer.exception.apiclient;

import java.io.Serial;

/**
 * The credentials are valid but not allowed to use the resource (HTTP 403).
 */
public class ForbiddenException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1372008591377470321L;

    public ForbiddenException(String message) {
        super(message, 403);
    }
}
