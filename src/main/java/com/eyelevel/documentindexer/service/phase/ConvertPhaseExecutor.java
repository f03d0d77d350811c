package com.eyelevel.documentindexer.service.phase;

import com.eyelevel.documentindexer.config.IndexingPipelineConfig;
import com.eyelevel.documentindexer.exception.PhaseExecutionException;
import com.eyelevel.documentindexer.exception.UnsupportedMimeTypeException;
import com.eyelevel.documentindexer.model.PipelinePhase;
import com.eyelevel.documentindexer.service.convert.TextExtractor;
import com.eyelevel.documentindexer.service.convert.TextExtractorFactory;
import com.eyelevel.documentindexer.service.job.JobEventLog;
import com.eyelevel.documentindexer.service.storage.StorageAccessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Extracts the plain text of the source document and caches it under the job's prefix.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConvertPhaseExecutor {

    static final String RESULT_FILE = "converted.txt";

    private final StorageAccessor storageAccessor;
    private final TextExtractorFactory textExtractorFactory;
    private final JobEventLog jobEventLog;
    private final IndexingPipelineConfig indexingPipelineConfig;

    public ConvertedText convertToText(UUID jobId, UUID fileId, String sourceUri, String mimeType) {
        jobEventLog.phaseStarted(jobId, PipelinePhase.CONVERT, 0, "Converting " + mimeType + " to text");
        try {
            TextExtractor extractor = textExtractorFactory.getExtractor(mimeType)
                                                          .orElseThrow(() -> new UnsupportedMimeTypeException(mimeType));
            byte[] source = storageAccessor.read(sourceUri);
            String text = extractor.extract(source);
            byte[] textBytes = text.getBytes(StandardCharsets.UTF_8);

            String resultUri = indexingPipelineConfig.getStorage().getConvertedBucket() + "/" + jobId + "/" + RESULT_FILE;
            storageAccessor.write(resultUri, textBytes, "text/plain; charset=utf-8");
            ConvertedText converted = new ConvertedText(resultUri, textBytes.length, DigestUtils.sha256Hex(textBytes));
            log.info("[JobId: {}, FileId: {}] Converted {} bytes of {} into {} bytes of text.", jobId, fileId,
                     source.length, mimeType, converted.byteSize());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("result_uri", resultUri);
            payload.put("byte_size", converted.byteSize());
            payload.put("checksum", converted.checksum());
            jobEventLog.phaseCompleted(jobId, PipelinePhase.CONVERT, 100, "Document converted to text", payload);
            return converted;
        } catch (Exception e) {
            log.error("[JobId: {}, FileId: {}] Convert phase failed.", jobId, fileId, e);
            try {
                jobEventLog.phaseFailed(jobId, PipelinePhase.CONVERT, 0, e);
            } catch (RuntimeException eventError) {
                log.error("[JobId: {}] Could not record the convert failure event.", jobId, eventError);
                e.addSuppressed(eventError);
            }
            throw PhaseExecutionException.wrap(PipelinePhase.CONVERT, e);
        }
    }
}
