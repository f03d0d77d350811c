package com.eyelevel.documentindexer.common.apiclient.embedding.model;

import java.util.List;

public record EmbeddingRequest(List<String> input, String model, int dimensions) {
}
