package com.eyelevel.documentindexer.service.orchestrator;

import com.eyelevel.documentindexer.config.IndexingPipelineConfig;
import com.eyelevel.documentindexer.exception.IndexingPreconditionException;
import com.eyelevel.documentindexer.exception.PhaseExecutionException;
import com.eyelevel.documentindexer.model.CreditReservation;
import com.eyelevel.documentindexer.model.IndexingJob;
import com.eyelevel.documentindexer.model.JobEventType;
import com.eyelevel.documentindexer.model.JobStatus;
import com.eyelevel.documentindexer.model.PipelinePhase;
import com.eyelevel.documentindexer.service.credit.CreditEstimate;
import com.eyelevel.documentindexer.service.credit.CreditEstimator;
import com.eyelevel.documentindexer.service.credit.CreditLedger;
import com.eyelevel.documentindexer.service.job.JobEventLog;
import com.eyelevel.documentindexer.service.job.JobStore;
import com.eyelevel.documentindexer.service.phase.ChunkParams;
import com.eyelevel.documentindexer.service.phase.ChunkPhaseExecutor;
import com.eyelevel.documentindexer.service.phase.ChunkSelector;
import com.eyelevel.documentindexer.service.phase.ChunkingResult;
import com.eyelevel.documentindexer.service.phase.ConvertPhaseExecutor;
import com.eyelevel.documentindexer.service.phase.ConvertedText;
import com.eyelevel.documentindexer.service.phase.EmbedPhaseExecutor;
import com.eyelevel.documentindexer.service.phase.EmbeddingResult;
import com.eyelevel.documentindexer.service.phase.IntegratePhaseExecutor;
import com.eyelevel.documentindexer.service.phase.IntegrationResult;
import com.eyelevel.documentindexer.service.phase.OcrPhaseExecutor;
import com.eyelevel.documentindexer.service.phase.OcrText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs the indexing pipeline for one file: convert, optional OCR, chunk, embed and integrate.
 *
 * <p>Credits are reserved before the first phase and either consumed right before the job is marked
 * COMPLETED or cancelled when it fails first. A consumed reservation is never cancelled. Every write
 * is flushed but not committed; the caller owns the transaction. Once the job row exists, failures
 * are reported through the returned summary instead of being thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndexingOrchestrator {

    private final JobStore jobStore;
    private final JobEventLog jobEventLog;
    private final CreditLedger creditLedger;
    private final CreditEstimator creditEstimator;
    private final ConvertPhaseExecutor convertPhaseExecutor;
    private final OcrPhaseExecutor ocrPhaseExecutor;
    private final ChunkPhaseExecutor chunkPhaseExecutor;
    private final EmbedPhaseExecutor embedPhaseExecutor;
    private final IntegratePhaseExecutor integratePhaseExecutor;
    private final IndexingPipelineConfig indexingPipelineConfig;

    static String operationId(UUID jobId) {
        return "rag_job_" + jobId;
    }

    static String ledgerOperationId(UUID jobId) {
        return operationId(jobId) + ":consume";
    }

    /**
     * Indexes the file described by {@code request}.
     *
     * @throws IndexingPreconditionException if the request is incomplete; no job is created in that case.
     */
    public OrchestrationSummary runIndexingJob(IndexingRequest request) {
        IndexingRequest.requireValid(request);
        log.info("[FileId: {}] Starting indexing pipeline (project={}, mimeType={}, needsOcr={}).",
                 request.fileId(), request.projectId(), request.mimeType(), request.needsOcr());

        CreditEstimate estimate = creditEstimator.estimate(request.needsOcr());
        IndexingJob job = jobStore.create(request.projectId(), request.fileId(), request.userId(), request.needsOcr());
        UUID jobId = job.getJobId();
        jobEventLog.append(jobId, JobEventType.JOB_QUEUED, PipelinePhase.CONVERT, 0,
                           "Job queued for file " + request.fileId(), null);

        List<PipelinePhase> phasesDone = new ArrayList<>();
        PipelineCounters counters = new PipelineCounters();
        CreditReservation reservation = null;
        boolean consumed = false;
        try {
            reservation = reserveCredits(job, estimate);
            jobStore.markRunning(job);
            jobEventLog.append(jobId, JobEventType.JOB_RUNNING, PipelinePhase.CONVERT, 0, "Job running", null);

            runPhases(job, request, phasesDone, counters);

            int actualCost = creditEstimator.actualCost(counters.ocrPages, counters.totalEmbeddings);
            int creditsUsed = Math.min(actualCost, reservation.getCreditsReserved());
            if (actualCost > creditsUsed) {
                log.warn("[JobId: {}] Actual cost {} exceeds the reserved {} credits. Charging the reserved amount.",
                         jobId, actualCost, creditsUsed);
            }

            creditLedger.consumeReservation(operationId(jobId), ledgerOperationId(jobId), creditsUsed);
            consumed = true;

            jobStore.markCompleted(job);
            phasesDone.add(PipelinePhase.READY);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("total_chunks", counters.totalChunks);
            payload.put("total_embeddings", counters.totalEmbeddings);
            payload.put("phases_done", wireNames(phasesDone));
            jobEventLog.append(jobId, JobEventType.JOB_COMPLETED, PipelinePhase.READY, 100,
                               "Job completed: " + counters.totalChunks + " chunks, " + counters.totalEmbeddings
                               + " embeddings", payload);
            log.info("[JobId: {}, FileId: {}] Pipeline completed: {} chunks, {} embeddings, {} credits used.", jobId,
                     request.fileId(), counters.totalChunks, counters.totalEmbeddings, creditsUsed);
            return new OrchestrationSummary(jobId, List.copyOf(phasesDone), JobStatus.COMPLETED, counters.totalChunks,
                                            counters.totalEmbeddings, creditsUsed, reservation.getReservationId(),
                                            null);
        } catch (Exception e) {
            return handleFailure(job, phasesDone, counters, reservation, consumed, e);
        }
    }

    private CreditReservation reserveCredits(IndexingJob job, CreditEstimate estimate) {
        log.info("[JobId: {}] Estimated {} credits (base={}, ocr={}, chunking={}, embedding={}).", job.getJobId(),
                 estimate.total(), estimate.baseCost(), estimate.ocrCost(), estimate.chunkingCost(),
                 estimate.embeddingCost());
        Duration ttl = Duration.ofMinutes(indexingPipelineConfig.getCredits().getReservationTtlMinutes());
        return creditLedger.createReservation(job.getUserId(), estimate.total(), operationId(job.getJobId()), ttl);
    }

    private void runPhases(IndexingJob job, IndexingRequest request, List<PipelinePhase> phasesDone,
                           PipelineCounters counters) {
        UUID jobId = job.getJobId();
        UUID fileId = request.fileId();

        ConvertedText converted = convertPhaseExecutor.convertToText(jobId, fileId, request.sourceUri(),
                                                                     request.mimeType());
        completePhase(job, PipelinePhase.CONVERT, phasesDone);
        String textUri = converted.resultUri();

        if (request.needsOcr()) {
            OcrText ocrText = ocrPhaseExecutor.runOcr(jobId, fileId, request.sourceUri(),
                                                      request.effectiveOcrStrategy());
            textUri = ocrText.resultUri();
            counters.ocrPages = ocrText.totalPages();
            completePhase(job, PipelinePhase.OCR, phasesDone);
        }

        IndexingPipelineConfig.Chunk chunkConfig = indexingPipelineConfig.getChunk();
        ChunkingResult chunking = chunkPhaseExecutor.chunkText(jobId, fileId, textUri,
                                                               new ChunkParams(chunkConfig.getMaxTokens(),
                                                                               chunkConfig.getOverlap()));
        counters.totalChunks = chunking.totalChunks();
        completePhase(job, PipelinePhase.CHUNK, phasesDone);

        IndexingPipelineConfig.Embedding embeddingConfig = indexingPipelineConfig.getEmbedding();
        EmbeddingResult embedding = embedPhaseExecutor.generateEmbeddings(jobId, fileId, embeddingConfig.getModel(),
                                                                          ChunkSelector.all(),
                                                                          embeddingConfig.getDimension());
        counters.totalEmbeddings = embedding.embedded();
        completePhase(job, PipelinePhase.EMBED, phasesDone);

        IntegrationResult integration = integratePhaseExecutor.integrateVectorIndex(jobId, fileId);
        completePhase(job, PipelinePhase.INTEGRATE, phasesDone);
        if (!integration.ready()) {
            log.warn("[JobId: {}, FileId: {}] Integration reported the document not ready (integrityValid={}). "
                     + "Continuing.", jobId, fileId, integration.integrityValid());
        }
    }

    private void completePhase(IndexingJob job, PipelinePhase phase, List<PipelinePhase> phasesDone) {
        jobStore.updatePhase(job, phase);
        phasesDone.add(phase);
    }

    private OrchestrationSummary handleFailure(IndexingJob job, List<PipelinePhase> phasesDone,
                                               PipelineCounters counters, CreditReservation reservation,
                                               boolean consumed, Exception error) {
        UUID jobId = job.getJobId();
        PipelinePhase lastDone = phasesDone.isEmpty() ? PipelinePhase.CONVERT : phasesDone.get(phasesDone.size() - 1);
        PipelineFailure failure = error instanceof PhaseExecutionException phaseError
                ? new PipelineFailure(phaseError.getPhase(), phaseError.errorType(), phaseError.getMessage())
                : new PipelineFailure(lastDone, error.getClass().getSimpleName(), error.getMessage());
        log.error("[JobId: {}, FileId: {}] Pipeline failed in phase {} after {}.", jobId, job.getFileId(),
                  failure.phase(), wireNames(phasesDone), error);

        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("error", String.valueOf(error.getMessage()));
            payload.put("error_type", failure.errorType());
            payload.put("failed_phase", failure.phase().wireName());
            payload.put("phases_done", wireNames(phasesDone));
            jobEventLog.append(jobId, JobEventType.JOB_FAILED, lastDone, 0, "Job failed: " + error.getMessage(),
                               payload);
            jobStore.markFailed(job, failure.message());
        } catch (Exception logError) {
            log.error("[JobId: {}] Could not record the job failure.", jobId, logError);
        }

        if (consumed) {
            log.warn("[JobId: {}] Reservation {} was already consumed; it is not cancelled.", jobId,
                     reservation.getReservationId());
        } else if (reservation != null) {
            try {
                creditLedger.cancelReservation(operationId(jobId));
            } catch (Exception releaseError) {
                log.error("[JobId: {}] Could not release credit reservation {}.", jobId,
                          reservation.getReservationId(), releaseError);
            }
        }

        return new OrchestrationSummary(jobId, List.copyOf(phasesDone), JobStatus.FAILED, counters.totalChunks,
                                        counters.totalEmbeddings, 0,
                                        reservation == null ? null : reservation.getReservationId(), failure);
    }

    private static List<String> wireNames(List<PipelinePhase> phases) {
        return phases.stream().map(PipelinePhase::wireName).toList();
    }

    private static final class PipelineCounters {
        private int ocrPages;
        private int totalChunks;
        private int totalEmbeddings;
    }
}
