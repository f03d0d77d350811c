package com.eyelevel.documentindexer.service.chunk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

/**
 * Verifies window sizes, overlap stride and degenerate inputs of the whitespace chunker.
 */
class TextChunkerTest {

    private final TextChunker textChunker = new TextChunker();

    @Test
    void split_producesOverlappingWindowsWithStrideOfMaxMinusOverlap() {
        String text = words(10);

        List<TextChunk> chunks = textChunker.split(text, 4, 1);

        assertEquals(List.of("w0 w1 w2 w3", "w3 w4 w5 w6", "w6 w7 w8 w9", "w9"),
                     chunks.stream().map(TextChunk::text).toList());
        assertEquals(List.of(4, 4, 4, 1), chunks.stream().map(TextChunk::tokenCount).toList());
    }

    @Test
    void split_keepsShortTextInSingleChunk() {
        List<TextChunk> chunks = textChunker.split("  hello \n\t world  ", 400, 60);

        assertEquals(1, chunks.size());
        assertEquals("hello world", chunks.get(0).text());
        assertEquals(2, chunks.get(0).tokenCount());
    }

    @Test
    void split_usesStrideOfOneWhenOverlapIsNotSmallerThanMax() {
        List<TextChunk> chunks = textChunker.split(words(3), 2, 5);

        assertEquals(List.of("w0 w1", "w1 w2", "w2"), chunks.stream().map(TextChunk::text).toList());
    }

    @Test
    void split_returnsOneEmptyChunkForBlankText() {
        List<TextChunk> chunks = textChunker.split("   \n ", 10, 2);

        assertEquals(List.of(new TextChunk("", 0)), chunks);
    }

    @Test
    void split_isDeterministicForTheSameInput() {
        String text = words(1000);

        assertEquals(textChunker.split(text, 400, 60), textChunker.split(text, 400, 60));
        assertEquals(3, textChunker.split(text, 400, 60).size());
    }

    @Test
    void split_rejectsInvalidWindowSettings() {
        assertThrows(IllegalArgumentException.class, () -> textChunker.split("a b", 0, 0));
        assertThrows(IllegalArgumentException.class, () -> textChunker.split("a b", 5, -1));
    }

    private static String words(int count) {
        return IntStream.range(0, count).mapToObj(i -> "w" + i).collect(Collectors.joining(" "));
    }
}
