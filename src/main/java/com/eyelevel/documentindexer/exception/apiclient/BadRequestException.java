package com.eyelevel.documentindexer.exception.apiclient;

import java.io.Serial;

/**
 * The provider rejected the request payload (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2637711457190210771L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
