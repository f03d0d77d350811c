package com.eyelevel.documentindexer;

import com.eyelevel.documentindexer.config.IndexingPipelineConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point of the document indexer.
 * <p>
 * Besides auto-configuration this enables:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: binds "app.indexing" to {@link IndexingPipelineConfig}.</li>
 *     <li>{@link EnableScheduling}: the credit reservation expiry sweep.</li>
 *     <li>{@link EnableRetry}: retries of transient OCR and embedding provider errors.</li>
 *     <li>{@link EnableJpaRepositories}: repositories under the repository package.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.documentindexer.repository")
@EnableConfigurationProperties(value = IndexingPipelineConfig.class)
@EnableRetry
public class DocumentIndexerApplication {

    public static void main(final String[] args) {
        log.info("🚀 Starting DocumentIndexerApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(DocumentIndexerApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "DocumentIndexer"));
        log.info("  - Embedding model: {}", env.getProperty("app.indexing.embedding.model", "text-embedding-3-large"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
