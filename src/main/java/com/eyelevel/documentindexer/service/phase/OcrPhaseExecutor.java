package com.eyelevel.documentindexer.service.phase;

import com.eyelevel.documentindexer.config.IndexingPipelineConfig;
import com.eyelevel.documentindexer.exception.PhaseExecutionException;
import com.eyelevel.documentindexer.model.OcrStrategy;
import com.eyelevel.documentindexer.model.PipelinePhase;
import com.eyelevel.documentindexer.service.job.JobEventLog;
import com.eyelevel.documentindexer.service.ocr.OcrAnalysis;
import com.eyelevel.documentindexer.service.ocr.OcrProvider;
import com.eyelevel.documentindexer.service.storage.StorageAccessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Runs OCR over the source document through a presigned URL and caches the recognized text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OcrPhaseExecutor {

    static final String RESULT_FILE = "ocr_result.txt";

    private final StorageAccessor storageAccessor;
    private final OcrProvider ocrProvider;
    private final JobEventLog jobEventLog;
    private final IndexingPipelineConfig indexingPipelineConfig;

    public OcrText runOcr(UUID jobId, UUID fileId, String sourceUri, OcrStrategy strategy) {
        jobEventLog.phaseStarted(jobId, PipelinePhase.OCR, 0, "Running OCR with strategy " + strategy);
        try {
            Duration urlTtl = Duration.ofMinutes(indexingPipelineConfig.getOcr().getSourceUrlTtlMinutes());
            URL documentUrl = storageAccessor.presignedReadUrl(sourceUri, urlTtl);
            OcrAnalysis analysis = ocrProvider.analyzeDocument(documentUrl.toString(), strategy);

            String resultUri = indexingPipelineConfig.getStorage().getOcrBucket() + "/" + jobId + "/" + RESULT_FILE;
            storageAccessor.write(resultUri, analysis.text().getBytes(StandardCharsets.UTF_8),
                                  "text/plain; charset=utf-8");
            OcrText ocrText = new OcrText(resultUri, analysis.pageCount(), analysis.language(), analysis.confidence());
            log.info("[JobId: {}, FileId: {}] OCR recognized {} pages (lang={}, confidence={}).", jobId, fileId,
                     ocrText.totalPages(), ocrText.lang(), ocrText.confidence());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("result_uri", resultUri);
            payload.put("total_pages", ocrText.totalPages());
            payload.put("model", analysis.modelUsed());
            payload.put("lang", ocrText.lang());
            payload.put("confidence", ocrText.confidence());
            jobEventLog.phaseCompleted(jobId, PipelinePhase.OCR, 100, "OCR completed", payload);
            return ocrText;
        } catch (Exception e) {
            log.error("[JobId: {}, FileId: {}] OCR phase failed.", jobId, fileId, e);
            try {
                jobEventLog.phaseFailed(jobId, PipelinePhase.OCR, 0, e);
            } catch (RuntimeException eventError) {
                log.error("[JobId: {}] Could not record the ocr failure event.", jobId, eventError);
                e.addSuppressed(eventError);
            }
            throw PhaseExecutionException.wrap(PipelinePhase.OCR, e);
        }
    }
}
