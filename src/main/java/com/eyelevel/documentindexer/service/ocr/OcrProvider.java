package com.eyelevel.documentindexer.service.ocr;

import com.eyelevel.documentindexer.model.OcrStrategy;

/**
 * Recognizes text in a document reachable at a URL.
 */
public interface OcrProvider {

    /**
     * @throws com.eyelevel.documentindexer.exception.OcrAnalysisException if the analysis fails or times out.
     */
    OcrAnalysis analyzeDocument(String documentUrl, OcrStrategy strategy);
}
