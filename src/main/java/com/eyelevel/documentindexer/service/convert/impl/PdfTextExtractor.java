package com.eyelevel.documentindexer.service.convert.impl;

import com.eyelevel.documentindexer.service.convert.TextExtractor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Extracts the text layer of a PDF with PDFBox. Scanned pages without a text layer yield nothing;
 * those documents go through OCR instead.
 */
@Slf4j
@Component
public class PdfTextExtractor implements TextExtractor {

    @Override
    public boolean supports(String mimeType) {
        return "application/pdf".equals(mimeType);
    }

    @Override
    public String extract(byte[] content) throws IOException {
        try (PDDocument document = Loader.loadPDF(content)) {
            log.debug("Extracting text from PDF with {} pages.", document.getNumberOfPages());
            return new PDFTextStripper().getText(document);
        }
    }
}
