package com.eyelevel.documentindexer.service.ocr;

/**
 * Layout statistics of one analyzed page.
 */
public record OcrPage(int pageNumber, Double width, Double height, String unit, Double angle, int lineCount,
                      int wordCount) {
}
