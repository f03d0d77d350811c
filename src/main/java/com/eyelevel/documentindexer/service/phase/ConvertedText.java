package com.eyelevel.documentindexer.service.phase;

/**
 * Output of the convert phase.
 *
 * @param resultUri location of the extracted UTF-8 text.
 * @param byteSize  size of the extracted text in bytes.
 * @param checksum  SHA-256 hex digest of the extracted text.
 */
public record ConvertedText(String resultUri, long byteSize, String checksum) {
}
