package com.eyelevel.documentindexer.common.apiclient.embedding.config;

import com.eyelevel.documentindexer.common.apiclient.authentication.Authentication;
import com.eyelevel.documentindexer.common.apiclient.authentication.impl.BearerTokenAuthentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Slf4j
@Configuration
public class EmbeddingClientConfiguration {

    // A batch of 100 large vectors exceeds the default 256 KB codec buffer.
    private static final int MAX_IN_MEMORY_SIZE = 32 * 1024 * 1024;

    @Value("${app.embedding-client.baseurl}")
    private String baseUrl;

    @Value("${app.embedding-client.api-key:}")
    private String apiKey;

    @Bean("embeddingWebClient")
    public WebClient embeddingWebClient() {
        log.info("Initializing embedding WebClient with base URL: {}", baseUrl);
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                                                          .codecs(configurer -> configurer.defaultCodecs()
                                                                                          .maxInMemorySize(
                                                                                                  MAX_IN_MEMORY_SIZE))
                                                          .build();
        return WebClient.builder().baseUrl(baseUrl).exchangeStrategies(strategies).build();
    }

    @Bean("embeddingAuthentication")
    public Authentication embeddingAuthentication() {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Embedding API key is not configured. Embedding calls will fail authentication.");
        }
        return new BearerTokenAuthentication(apiKey);
    }
}
