package com.eyelevel.documentindexer.service.phase;

import java.util.List;
import java.util.UUID;

/**
 * Which chunks of a file the embed phase should consider: all of them, an explicit set of chunk
 * ids, or an inclusive range of chunk indexes.
 */
public record ChunkSelector(Mode mode, List<UUID> chunkIds, int startIndex, int endIndex) {

    public enum Mode {
        ALL,
        CHUNK_IDS,
        INDEX_RANGE
    }

    public static ChunkSelector all() {
        return new ChunkSelector(Mode.ALL, List.of(), 0, 0);
    }

    public static ChunkSelector ofChunkIds(List<UUID> chunkIds) {
        return new ChunkSelector(Mode.CHUNK_IDS, List.copyOf(chunkIds), 0, 0);
    }

    /**
     * Chunks whose index lies in {@code [startIndex, endIndex]}.
     */
    public static ChunkSelector ofIndexRange(int startIndex, int endIndex) {
        if (startIndex < 0 || endIndex < startIndex) {
            throw new IllegalArgumentException("Invalid chunk index range [" + startIndex + ", " + endIndex + "]");
        }
        return new ChunkSelector(Mode.INDEX_RANGE, List.of(), startIndex, endIndex);
    }
}
