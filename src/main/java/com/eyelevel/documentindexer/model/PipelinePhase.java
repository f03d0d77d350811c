package com.eyelevel.documentindexer.model;

import java.util.Locale;

/**
 * Ordered positions of the indexing pipeline: convert, optional OCR, chunk, embed, integrate, ready.
 */
public enum PipelinePhase {
    CONVERT,
    OCR,
    CHUNK,
    EMBED,
    INTEGRATE,
    READY;

    /**
     * Progress percentage reported for a job whose current phase is this one.
     */
    public int progressPct() {
        return switch (this) {
            case CONVERT -> 15;
            case OCR -> 35;
            case CHUNK -> 55;
            case EMBED -> 75;
            case INTEGRATE -> 90;
            case READY -> 100;
        };
    }

    /**
     * Lower-case name used inside event payloads.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
