package com.eyelevel.documentindexer.exception;

import java.io.Serial;

public class UnsupportedMimeTypeException extends IndexingException {
    @Serial
    private static final long serialVersionUID = -4146823766536414925L;

    public UnsupportedMimeTypeException(String mimeType) {
        super("No text extractor supports MIME type: " + mimeType);
    }
}
