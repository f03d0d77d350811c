package com.eyelevel.documentindexer.service.convert.impl;

import com.eyelevel.documentindexer.service.convert.TextExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Decodes text formats as UTF-8, falling back to ISO-8859-1 when the bytes are not valid UTF-8.
 */
@Slf4j
@Component
public class PlainTextExtractor implements TextExtractor {

    private static final Set<String> SUPPORTED = Set.of("text/plain", "text/markdown", "text/csv");

    @Override
    public boolean supports(String mimeType) {
        return SUPPORTED.contains(mimeType);
    }

    @Override
    public String extract(byte[] content) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                                         .onMalformedInput(CodingErrorAction.REPORT)
                                         .onUnmappableCharacter(CodingErrorAction.REPORT)
                                         .decode(ByteBuffer.wrap(content))
                                         .toString();
        } catch (CharacterCodingException e) {
            log.debug("Content is not valid UTF-8, decoding as ISO-8859-1.");
            return new String(content, StandardCharsets.ISO_8859_1);
        }
    }
}
