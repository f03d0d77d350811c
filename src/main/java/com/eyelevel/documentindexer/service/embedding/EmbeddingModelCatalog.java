package com.eyelevel.documentindexer.service.embedding;

import com.eyelevel.documentindexer.exception.EmbeddingValidationException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Embedding models the pipeline accepts and the output dimensions each of them supports.
 */
@Component
public class EmbeddingModelCatalog {

    private static final Map<String, Set<Integer>> SUPPORTED_DIMENSIONS = Map.of(
            "text-embedding-3-large", Set.of(256, 1024, 1536, 3072),
            "text-embedding-3-small", Set.of(256, 512, 1536),
            "text-embedding-ada-002", Set.of(1536));

    /**
     * @throws EmbeddingValidationException if the model is unknown or does not produce {@code dimension}.
     */
    public void validate(String model, int dimension) {
        Set<Integer> dimensions = SUPPORTED_DIMENSIONS.get(model);
        if (dimensions == null) {
            throw new EmbeddingValidationException("Unsupported embedding model: " + model);
        }
        if (!dimensions.contains(dimension)) {
            throw new EmbeddingValidationException(
                    "Dimension " + dimension + " is not supported by " + model + "; allowed: " + dimensions);
        }
    }

    public boolean isSupported(String model) {
        return SUPPORTED_DIMENSIONS.containsKey(model);
    }
}
