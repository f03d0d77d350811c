package com.eyelevel.documentindexer.service.ocr;

import java.util.List;

/**
 * Result of analyzing one document.
 *
 * @param text       recognized text of the whole document.
 * @param pages      per-page statistics in page order.
 * @param confidence mean word confidence in [0, 1], or {@code null} when no words were recognized.
 * @param language   dominant locale reported by the provider, or {@code null}.
 * @param modelUsed  provider model that produced the result.
 */
public record OcrAnalysis(String text, List<OcrPage> pages, Double confidence, String language, String modelUsed) {

    public int pageCount() {
        return pages.size();
    }
}
