package com.eyelevel.documentindexer.common.apiclient.ocr.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzeResult(String modelId, String content, List<Page> pages, List<Language> languages) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Page(Integer pageNumber, Double width, Double height, String unit, Double angle,
                       List<Map<String, Object>> lines, List<Word> words) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Word(String content, Double confidence) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Language(String locale, Double confidence) {
    }
}
