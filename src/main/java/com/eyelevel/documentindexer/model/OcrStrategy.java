package com.eyelevel.documentindexer.model;

/**
 * Trade-off requested from the OCR provider.
 */
public enum OcrStrategy {
    /**
     * Plain text read model, lowest latency.
     */
    FAST,
    /**
     * Layout-aware document model, slower but better on complex pages.
     */
    ACCURATE,
    /**
     * Default. Currently resolves to the same model as {@link #FAST}.
     */
    BALANCED
}
