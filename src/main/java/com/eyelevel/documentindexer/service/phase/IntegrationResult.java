package com.eyelevel.documentindexer.service.phase;

/**
 * Outcome of publishing a file's embeddings to the vector index.
 *
 * @param ready          at least one active embedding exists.
 * @param integrityValid every chunk has exactly one active embedding.
 */
public record IntegrationResult(int activated, int deactivated, boolean ready, boolean integrityValid) {
}
