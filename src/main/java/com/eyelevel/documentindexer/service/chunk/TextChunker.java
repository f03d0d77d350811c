package com.eyelevel.documentindexer.service.chunk;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into overlapping windows of whitespace-delimited tokens.
 *
 * <p>Whitespace tokens only approximate model tokens. Windows hold at most {@code maxTokens} tokens and
 * start every {@code max(1, maxTokens - overlap)} tokens, so the tail of the text may appear in more
 * than one window.
 */
@Component
public class TextChunker {

    private static final Pattern TOKEN = Pattern.compile("\\S+");

    public List<TextChunk> split(String text, int maxTokens, int overlap) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got " + maxTokens);
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap must not be negative, got " + overlap);
        }

        List<String> tokens = tokenize(text);
        if (tokens.isEmpty()) {
            return List.of(new TextChunk("", 0));
        }

        int stride = Math.max(1, maxTokens - overlap);
        List<TextChunk> chunks = new ArrayList<>();
        for (int start = 0; start < tokens.size(); start += stride) {
            List<String> window = tokens.subList(start, Math.min(start + maxTokens, tokens.size()));
            chunks.add(new TextChunk(String.join(" ", window), window.size()));
        }
        return chunks;
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
