package com.eyelevel.documentindexer.service.convert;

import java.io.IOException;

/**
 * Extracts plain text from a document of one family of MIME types.
 */
public interface TextExtractor {

    /**
     * @param mimeType normalized MIME type, lower case and without parameters.
     */
    boolean supports(String mimeType);

    /**
     * Extracts the readable text of the document.
     *
     * @param content raw document bytes.
     * @return extracted text, possibly empty.
     * @throws IOException if the document cannot be parsed.
     */
    String extract(byte[] content) throws IOException;
}
