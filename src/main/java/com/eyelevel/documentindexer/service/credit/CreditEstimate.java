package com.eyelevel.documentindexer.service.credit;

/**
 * Up-front cost of an indexing job, broken down per phase.
 */
public record CreditEstimate(int baseCost, int ocrCost, int chunkingCost, int embeddingCost) {

    public int total() {
        return baseCost + ocrCost + chunkingCost + embeddingCost;
    }
}
