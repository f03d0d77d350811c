package com.eyelevel.documentindexer.service.phase;

public record ChunkParams(int maxTokens, int overlap) {

    public ChunkParams {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got " + maxTokens);
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap must not be negative, got " + overlap);
        }
    }
}
