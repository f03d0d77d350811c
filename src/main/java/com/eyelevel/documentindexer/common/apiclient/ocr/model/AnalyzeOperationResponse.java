package com.eyelevel.documentindexer.common.apiclient.ocr.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of the analyze-operation polling endpoint. {@code analyzeResult} is only present once
 * {@code status} is {@code succeeded}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzeOperationResponse(String status, AnalyzeResult analyzeResult, ErrorDetail error) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ErrorDetail(String code, String message) {
    }
}
