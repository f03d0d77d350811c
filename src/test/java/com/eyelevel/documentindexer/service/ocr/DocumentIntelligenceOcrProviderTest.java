package com.eyelevel.documentindexer.service.ocr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.eyelevel.documentindexer.common.apiclient.ocr.DocumentIntelligenceApiClient;
import com.eyelevel.documentindexer.common.apiclient.ocr.model.AnalyzeOperationResponse;
import com.eyelevel.documentindexer.common.apiclient.ocr.model.AnalyzeResult;
import com.eyelevel.documentindexer.exception.OcrAnalysisException;
import com.eyelevel.documentindexer.model.OcrStrategy;
import java.net.URI;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Verifies model selection, polling and result parsing of the Document Intelligence provider.
 */
class DocumentIntelligenceOcrProviderTest {

    private static final String DOCUMENT_URL = "https://uploads.s3.amazonaws.com/scan.pdf";
    private static final URI OPERATION = URI.create("https://ocr.example.com/operations/42");

    private final DocumentIntelligenceApiClient apiClient = mock(DocumentIntelligenceApiClient.class);
    private final DocumentIntelligenceOcrProvider provider = new DocumentIntelligenceOcrProvider(apiClient, 5, 1);

    @Test
    void analyzeDocument_pollsUntilSucceededAndParsesPages() {
        AnalyzeResult result = new AnalyzeResult("prebuilt-read", "Invoice 42\nTotal 10", List.of(
                new AnalyzeResult.Page(1, 8.5, 11.0, "inch", 0.0, List.of(Map.of(), Map.of()),
                                       List.of(new AnalyzeResult.Word("Invoice", 0.9),
                                               new AnalyzeResult.Word("42", 0.7))),
                new AnalyzeResult.Page(2, 8.5, 11.0, "inch", 1.5, null, null)),
                List.of(new AnalyzeResult.Language("en", 0.99)));
        when(apiClient.startAnalysis("prebuilt-read", DOCUMENT_URL)).thenReturn(OPERATION);
        when(apiClient.fetchAnalysis(OPERATION)).thenReturn(new AnalyzeOperationResponse("notStarted", null, null),
                                                           new AnalyzeOperationResponse("running", null, null),
                                                           new AnalyzeOperationResponse("succeeded", result, null));

        OcrAnalysis analysis = provider.analyzeDocument(DOCUMENT_URL, OcrStrategy.FAST);

        verify(apiClient, times(3)).fetchAnalysis(OPERATION);
        assertEquals("Invoice 42\nTotal 10", analysis.text());
        assertEquals(2, analysis.pageCount());
        assertEquals(2, analysis.pages().get(0).lineCount());
        assertEquals(2, analysis.pages().get(0).wordCount());
        assertEquals(0, analysis.pages().get(1).wordCount());
        assertEquals(0.8, analysis.confidence(), 1e-9);
        assertEquals("en", analysis.language());
        assertEquals("prebuilt-read", analysis.modelUsed());
    }

    @Test
    void analyzeDocument_failsWhenProviderReportsFailure() {
        when(apiClient.startAnalysis("prebuilt-document", DOCUMENT_URL)).thenReturn(OPERATION);
        when(apiClient.fetchAnalysis(OPERATION)).thenReturn(new AnalyzeOperationResponse(
                "failed", null, new AnalyzeOperationResponse.ErrorDetail("InvalidContent", "Corrupt file")));

        OcrAnalysisException error = assertThrows(OcrAnalysisException.class,
                () -> provider.analyzeDocument(DOCUMENT_URL, OcrStrategy.ACCURATE));

        assertTrue(error.getMessage().contains("Corrupt file"));
    }

    @Test
    void analyzeDocument_timesOutWhenAnalysisNeverFinishes() {
        DocumentIntelligenceOcrProvider impatient = new DocumentIntelligenceOcrProvider(apiClient, 0, 1);
        when(apiClient.startAnalysis("prebuilt-read", DOCUMENT_URL)).thenReturn(OPERATION);
        when(apiClient.fetchAnalysis(OPERATION)).thenReturn(new AnalyzeOperationResponse("running", null, null));

        OcrAnalysisException error = assertThrows(OcrAnalysisException.class,
                () -> impatient.analyzeDocument(DOCUMENT_URL, OcrStrategy.BALANCED));

        assertTrue(error.getMessage().contains("did not finish"));
    }

    @Test
    void modelFor_mapsEveryStrategy() {
        assertEquals("prebuilt-read", DocumentIntelligenceOcrProvider.modelFor(OcrStrategy.FAST));
        assertEquals("prebuilt-document", DocumentIntelligenceOcrProvider.modelFor(OcrStrategy.ACCURATE));
        assertEquals("prebuilt-read", DocumentIntelligenceOcrProvider.modelFor(OcrStrategy.BALANCED));
    }

    @Test
    void toAnalysis_handlesResultWithoutPagesOrLanguages() {
        OcrAnalysis analysis = DocumentIntelligenceOcrProvider.toAnalysis(
                new AnalyzeResult("prebuilt-read", null, null, null), "prebuilt-read");

        assertEquals("", analysis.text());
        assertEquals(0, analysis.pageCount());
        assertNull(analysis.confidence());
        assertNull(analysis.language());
    }
}
