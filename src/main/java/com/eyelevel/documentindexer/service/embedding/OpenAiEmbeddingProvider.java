package com.eyelevel.documentindexer.service.embedding;

import com.eyelevel.documentindexer.common.apiclient.embedding.OpenAiEmbeddingApiClient;
import com.eyelevel.documentindexer.common.apiclient.embedding.model.EmbeddingResponse;
import com.eyelevel.documentindexer.exception.EmbeddingValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * {@link EmbeddingProvider} backed by an OpenAI-compatible embeddings API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private final OpenAiEmbeddingApiClient apiClient;

    @Override
    public List<float[]> generateEmbeddings(List<String> texts, String model, int dimension) {
        if (texts.isEmpty()) {
            return List.of();
        }
        EmbeddingResponse response = apiClient.createEmbeddings(texts, model, dimension);
        if (response == null || response.data() == null || response.data().size() != texts.size()) {
            int received = response == null || response.data() == null ? 0 : response.data().size();
            throw new EmbeddingValidationException(
                    "Expected " + texts.size() + " embeddings but received " + received);
        }

        float[][] ordered = new float[texts.size()][];
        for (EmbeddingResponse.EmbeddingData data : response.data()) {
            if (data.index() < 0 || data.index() >= texts.size() || ordered[data.index()] != null) {
                throw new EmbeddingValidationException("Embedding response has an invalid index " + data.index());
            }
            if (data.embedding() == null || data.embedding().length != dimension) {
                throw new EmbeddingValidationException(
                        "Embedding " + data.index() + " has " + (data.embedding() == null ? 0 : data.embedding().length)
                        + " dimensions, expected " + dimension);
            }
            ordered[data.index()] = data.embedding();
        }
        log.debug("Received {} embeddings of dimension {} from '{}'.", texts.size(), dimension, model);
        return new ArrayList<>(Arrays.asList(ordered));
    }
}
