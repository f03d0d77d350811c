package com.eyelevel.documentindexer.service.phase;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.eyelevel.documentindexer.config.IndexingPipelineConfig;
import com.eyelevel.documentindexer.exception.OcrAnalysisException;
import com.eyelevel.documentindexer.exception.PhaseExecutionException;
import com.eyelevel.documentindexer.model.OcrStrategy;
import com.eyelevel.documentindexer.model.PipelinePhase;
import com.eyelevel.documentindexer.service.job.JobEventLog;
import com.eyelevel.documentindexer.service.ocr.OcrAnalysis;
import com.eyelevel.documentindexer.service.ocr.OcrPage;
import com.eyelevel.documentindexer.service.ocr.OcrProvider;
import com.eyelevel.documentindexer.service.storage.StorageAccessor;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

/**
 * Verifies that the OCR phase hands the provider a presigned URL and caches the recognized text.
 */
class OcrPhaseExecutorTest {

    private final StorageAccessor storageAccessor = mock(StorageAccessor.class);
    private final OcrProvider ocrProvider = mock(OcrProvider.class);
    private final JobEventLog jobEventLog = mock(JobEventLog.class);
    private final OcrPhaseExecutor executor =
            new OcrPhaseExecutor(storageAccessor, ocrProvider, jobEventLog, new IndexingPipelineConfig());

    private final UUID jobId = UUID.randomUUID();
    private final UUID fileId = UUID.randomUUID();

    @Test
    void runOcr_storesRecognizedTextAndReportsPages() throws Exception {
        URL presigned = new URL("https://uploads.s3.amazonaws.com/scan.pdf?X-Amz-Signature=abc");
        when(storageAccessor.presignedReadUrl("uploads/scan.pdf", Duration.ofMinutes(15))).thenReturn(presigned);
        OcrPage page = new OcrPage(1, 8.5, 11.0, "inch", 0.0, 2, 6);
        when(ocrProvider.analyzeDocument(presigned.toString(), OcrStrategy.ACCURATE))
                .thenReturn(new OcrAnalysis("scanned words", List.of(page, page), 0.97, "en", "prebuilt-document"));

        OcrText ocrText = executor.runOcr(jobId, fileId, "uploads/scan.pdf", OcrStrategy.ACCURATE);

        assertEquals("rag-cache-pages/" + jobId + "/ocr_result.txt", ocrText.resultUri());
        assertEquals(2, ocrText.totalPages());
        assertEquals("en", ocrText.lang());
        verify(storageAccessor).write(ocrText.resultUri(), "scanned words".getBytes(StandardCharsets.UTF_8),
                                      "text/plain; charset=utf-8");
        verify(jobEventLog).phaseCompleted(eq(jobId), eq(PipelinePhase.OCR), eq(100), anyString(), any());
    }

    @Test
    void runOcr_wrapsProviderFailures() throws Exception {
        when(storageAccessor.presignedReadUrl(anyString(), any()))
                .thenReturn(new URL("https://uploads.s3.amazonaws.com/scan.pdf"));
        when(ocrProvider.analyzeDocument(anyString(), any())).thenThrow(new OcrAnalysisException("Analysis failed"));

        PhaseExecutionException error = assertThrows(PhaseExecutionException.class,
                () -> executor.runOcr(jobId, fileId, "uploads/scan.pdf", OcrStrategy.FAST));

        assertEquals(PipelinePhase.OCR, error.getPhase());
        verify(storageAccessor, never()).write(anyString(), any(), anyString());
        verify(jobEventLog).phaseFailed(eq(jobId), eq(PipelinePhase.OCR), eq(0), any(Throwable.class));
    }
}
