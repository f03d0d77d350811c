package com.eyelevel.documentindexer.exception;

import java.io.Serial;

/**
 * Thrown for an unknown embedding model, a dimension the model does not support, or a provider
 * response whose vector count or size does not match the request.
 */
public class EmbeddingValidationException extends IndexingException {
    @Serial
    private static final long serialVersionUID = 1846120950672370045L;

    public EmbeddingValidationException(String message) {
        super(message);
    }
}
