package com.eyelevel.documentindexer.service.phase;

/**
 * Output of the OCR phase. {@code lang} and {@code confidence} are informational and may be null.
 */
public record OcrText(String resultUri, int totalPages, String lang, Double confidence) {
}
