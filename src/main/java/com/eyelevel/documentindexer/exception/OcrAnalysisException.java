package com.eyelevel.documentindexer.exception;

import java.io.Serial;

/**
 * Terminal OCR failure: the provider reported the analysis as failed or canceled, or it did not
 * finish before the polling deadline.
 */
public class OcrAnalysisException extends IndexingException {
    @Serial
    private static final long serialVersionUID = -6021745510283374411L;

    public OcrAnalysisException(String message) {
        super(message);
    }
}
