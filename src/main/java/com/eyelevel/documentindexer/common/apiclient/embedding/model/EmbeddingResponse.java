package com.eyelevel.documentindexer.common.apiclient.embedding.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response of an OpenAI-compatible {@code /v1/embeddings} call. Entries in {@code data} carry the
 * position of their input text in {@code index}; providers do not guarantee they arrive in order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingResponse(List<EmbeddingData> data, String model, Usage usage) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmbeddingData(int index, float[] embedding) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Usage(@JsonProperty("prompt_tokens") Integer promptTokens,
                        @JsonProperty("total_tokens") Integer totalTokens) {
    }
}
