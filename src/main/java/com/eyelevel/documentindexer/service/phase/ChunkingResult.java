package com.eyelevel.documentindexer.service.phase;

import java.util.List;
import java.util.UUID;

/**
 * @param chunkIds ids of the stored chunks in chunk-index order.
 */
public record ChunkingResult(int totalChunks, List<UUID> chunkIds) {
}
