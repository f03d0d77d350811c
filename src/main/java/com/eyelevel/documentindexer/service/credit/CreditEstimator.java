package com.eyelevel.documentindexer.service.credit;

import com.eyelevel.documentindexer.config.IndexingPipelineConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Prices indexing jobs from the {@code app.indexing.credits} settings. The estimate is reserved
 * before the pipeline starts; the actual cost is computed from what the pipeline did.
 */
@Component
@RequiredArgsConstructor
public class CreditEstimator {

    private final IndexingPipelineConfig indexingPipelineConfig;

    public CreditEstimate estimate(boolean needsOcr) {
        IndexingPipelineConfig.Credits credits = indexingPipelineConfig.getCredits();
        int ocrCost = needsOcr ? credits.getOcrCostPerPage() * credits.getEstimatedPages() : 0;
        return new CreditEstimate(credits.getBaseCost(), ocrCost, credits.getChunkingCost(),
                                  credits.getEmbeddingCostPerChunk() * credits.getEstimatedChunks());
    }

    /**
     * @param ocrPages pages processed by OCR, 0 when OCR did not run.
     * @param embedded chunks embedded by this job; skipped chunks are free.
     */
    public int actualCost(int ocrPages, int embedded) {
        IndexingPipelineConfig.Credits credits = indexingPipelineConfig.getCredits();
        return credits.getBaseCost() + credits.getOcrCostPerPage() * ocrPages + credits.getChunkingCost()
               + credits.getEmbeddingCostPerChunk() * embedded;
    }
}
