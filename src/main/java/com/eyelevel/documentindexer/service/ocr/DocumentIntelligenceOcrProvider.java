package com.eyelevel.documentindexer.service.ocr;

import com.eyelevel.documentindexer.common.apiclient.ocr.DocumentIntelligenceApiClient;
import com.eyelevel.documentindexer.common.apiclient.ocr.model.AnalyzeOperationResponse;
import com.eyelevel.documentindexer.common.apiclient.ocr.model.AnalyzeResult;
import com.eyelevel.documentindexer.exception.OcrAnalysisException;
import com.eyelevel.documentindexer.model.OcrStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link OcrProvider} backed by Azure Document Intelligence. Submits the document, then polls the
 * returned operation until it succeeds, fails or the analysis timeout elapses.
 */
@Slf4j
@Service
public class DocumentIntelligenceOcrProvider implements OcrProvider {

    private final DocumentIntelligenceApiClient apiClient;
    private final Duration analysisTimeout;
    private final Duration pollInterval;

    public DocumentIntelligenceOcrProvider(DocumentIntelligenceApiClient apiClient,
                                           @Value("${app.ocr-client.analysis-timeout-seconds:300}") long timeoutSeconds,
                                           @Value("${app.ocr-client.poll-interval-ms:2000}") long pollIntervalMs) {
        this.apiClient = apiClient;
        this.analysisTimeout = Duration.ofSeconds(timeoutSeconds);
        this.pollInterval = Duration.ofMillis(pollIntervalMs);
    }

    static String modelFor(OcrStrategy strategy) {
        return switch (strategy) {
            case FAST, BALANCED -> "prebuilt-read";
            case ACCURATE -> "prebuilt-document";
        };
    }

    @Override
    public OcrAnalysis analyzeDocument(String documentUrl, OcrStrategy strategy) {
        String modelId = modelFor(strategy);
        URI operationLocation = apiClient.startAnalysis(modelId, documentUrl);
        AnalyzeResult result = awaitResult(operationLocation);
        OcrAnalysis analysis = toAnalysis(result, modelId);
        log.info("OCR finished with model '{}': {} pages, {} characters.", modelId, analysis.pageCount(),
                 analysis.text().length());
        return analysis;
    }

    private AnalyzeResult awaitResult(URI operationLocation) {
        Instant deadline = Instant.now().plus(analysisTimeout);
        while (true) {
            AnalyzeOperationResponse response = apiClient.fetchAnalysis(operationLocation);
            String status = Objects.requireNonNullElse(response.status(), "").toLowerCase(Locale.ROOT);
            switch (status) {
                case "succeeded" -> {
                    if (response.analyzeResult() == null) {
                        throw new OcrAnalysisException("Analysis succeeded without a result");
                    }
                    return response.analyzeResult();
                }
                case "failed", "canceled" -> throw new OcrAnalysisException(
                        "Analysis " + status + describeError(response));
                default -> log.debug("Analysis status '{}', polling again.", status);
            }
            if (!Instant.now().plus(pollInterval).isBefore(deadline)) {
                throw new OcrAnalysisException("Analysis did not finish within " + analysisTimeout.toSeconds() + "s");
            }
            sleep();
        }
    }

    private void sleep() {
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OcrAnalysisException("Interrupted while waiting for analysis");
        }
    }

    private static String describeError(AnalyzeOperationResponse response) {
        AnalyzeOperationResponse.ErrorDetail error = response.error();
        return error == null ? "" : ": " + error.code() + " " + error.message();
    }

    static OcrAnalysis toAnalysis(AnalyzeResult result, String modelId) {
        List<OcrPage> pages = new ArrayList<>();
        double confidenceSum = 0;
        int confidenceCount = 0;
        if (result.pages() != null) {
            for (AnalyzeResult.Page page : result.pages()) {
                List<AnalyzeResult.Word> words = page.words() == null ? List.of() : page.words();
                for (AnalyzeResult.Word word : words) {
                    if (word.confidence() != null) {
                        confidenceSum += word.confidence();
                        confidenceCount++;
                    }
                }
                pages.add(new OcrPage(page.pageNumber() == null ? pages.size() + 1 : page.pageNumber(),
                                      page.width(), page.height(), page.unit(), page.angle(),
                                      page.lines() == null ? 0 : page.lines().size(), words.size()));
            }
        }
        Double confidence = confidenceCount == 0 ? null : confidenceSum / confidenceCount;
        String language = result.languages() == null || result.languages().isEmpty() ? null
                : result.languages().get(0).locale();
        return new OcrAnalysis(Objects.requireNonNullElse(result.content(), ""), pages, confidence, language, modelId);
    }
}
