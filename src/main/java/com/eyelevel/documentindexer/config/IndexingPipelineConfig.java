package com.eyelevel.documentindexer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Binds application properties under the "app.indexing" prefix: chunking windows, embedding model,
 * cache buckets, credit pricing and provider retry policy.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.indexing")
public class IndexingPipelineConfig {

    @Valid
    private Chunk chunk = new Chunk();
    @Valid
    private Embedding embedding = new Embedding();
    @Valid
    private Storage storage = new Storage();
    @Valid
    private Credits credits = new Credits();
    @Valid
    private Ocr ocr = new Ocr();
    @Valid
    private RetryConfig retry = new RetryConfig();

    @Data
    public static class Chunk {
        @Min(1)
        private int maxTokens = 400;
        @Min(0)
        private int overlap = 60;
    }

    @Data
    public static class Embedding {
        @NotBlank
        private String model = "text-embedding-3-large";
        @Min(1)
        private int dimension = 1536;
        @Min(1)
        private int batchSize = 100;
    }

    @Data
    public static class Storage {
        /**
         * Bucket receiving the text extracted by the convert phase.
         */
        @NotBlank
        private String convertedBucket = "rag-cache-jobs";
        /**
         * Bucket receiving the text produced by the OCR phase.
         */
        @NotBlank
        private String ocrBucket = "rag-cache-pages";
    }

    @Data
    public static class Credits {
        private int baseCost = 10;
        private int ocrCostPerPage = 5;
        private int chunkingCost = 5;
        private int embeddingCostPerChunk = 2;
        private int estimatedPages = 1;
        private int estimatedChunks = 10;
        @Min(1)
        private long reservationTtlMinutes = 30;
    }

    @Data
    public static class Ocr {
        /**
         * Lifetime of the presigned URL handed to the OCR provider.
         */
        @Min(1)
        private long sourceUrlTtlMinutes = 15;
    }

    @Data
    public static class RetryConfig {
        @Min(1)
        private int attempts = 3;
        private long initialDelayMs = 1000;
        @DecimalMin("1.0")
        private double multiplier = 2.0;
    }
}
