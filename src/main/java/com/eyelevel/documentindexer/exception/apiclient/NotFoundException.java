package com.eyelevel.documentindexer.exception.apiclient;

import java.io.Serial;

/**
 * The model, endpoint or operation does not exist (HTTP 404).
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = 8177232911450913820L;

    public NotFoundException(String message) {
        super(message, 404);
    }
}
