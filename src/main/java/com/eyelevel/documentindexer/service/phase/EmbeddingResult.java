package com.eyelevel.documentindexer.service.phase;

/**
 * @param totalChunks all chunks of the file, whatever the selection was.
 * @param embedded    chunks embedded by this run.
 */
public record EmbeddingResult(int totalChunks, int embedded) {

    public int skipped() {
        return totalChunks - embedded;
    }
}
