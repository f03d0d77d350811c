package com.eyelevel.documentindexer.service.embedding;

import java.util.List;

/**
 * Computes embedding vectors for a batch of texts.
 *
 * <p>Implementations retry transient provider errors themselves and must check that they return
 * exactly one vector of {@code dimension} floats per input text, in input order.
 */
public interface EmbeddingProvider {

    List<float[]> generateEmbeddings(List<String> texts, String model, int dimension);
}
