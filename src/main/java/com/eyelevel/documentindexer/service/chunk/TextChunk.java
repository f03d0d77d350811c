package com.eyelevel.documentindexer.service.chunk;

/**
 * One window produced by {@link TextChunker}: the joined tokens and how many there were.
 */
public record TextChunk(String text, int tokenCount) {
}
