package com.eyelevel.documentindexer.service.orchestrator;

import com.eyelevel.documentindexer.exception.IndexingPreconditionException;
import com.eyelevel.documentindexer.model.OcrStrategy;
import com.eyelevel.documentindexer.service.storage.StorageUri;

import java.util.UUID;

/**
 * Everything needed to index one file.
 *
 * @param sourceUri   location of the original document, as {@code bucket/path}.
 * @param ocrStrategy used only when {@code needsOcr}; {@code null} means {@link OcrStrategy#BALANCED}.
 */
public record IndexingRequest(UUID projectId, UUID fileId, UUID userId, String mimeType, boolean needsOcr,
                              OcrStrategy ocrStrategy, String sourceUri) {

    public OcrStrategy effectiveOcrStrategy() {
        return ocrStrategy == null ? OcrStrategy.BALANCED : ocrStrategy;
    }

    /**
     * Checks everything a run needs before it may touch any state.
     *
     * @throws IndexingPreconditionException if {@code request} is null or incomplete.
     */
    public static void requireValid(IndexingRequest request) {
        if (request == null) {
            throw new IndexingPreconditionException("Indexing request must not be null");
        }
        if (request.projectId() == null || request.fileId() == null) {
            throw new IndexingPreconditionException("projectId and fileId are required");
        }
        if (request.sourceUri() == null || request.sourceUri().isBlank()) {
            throw new IndexingPreconditionException("sourceUri is required to read the document");
        }
        if (!StorageUri.isValid(request.sourceUri())) {
            throw new IndexingPreconditionException(
                    "sourceUri '" + request.sourceUri() + "' is not of the form 'bucket/path'");
        }
    }
}
