package com.eyelevel.documentindexer.common.apiclient.ocr.config;

import com.eyelevel.documentindexer.common.apiclient.authentication.Authentication;
import com.eyelevel.documentindexer.common.apiclient.authentication.impl.APIKeyAuthentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * {@link WebClient} and credentials for the Azure Document Intelligence OCR provider.
 */
@Slf4j
@Configuration
public class DocumentIntelligenceClientConfiguration {

    @Value("${app.ocr-client.baseurl}")
    private String baseUrl;

    @Value("${app.ocr-client.auth-key-name:Ocp-Apim-Subscription-Key}")
    private String headerName;

    @Value("${app.ocr-client.auth-key-value:}")
    private String headerValue;

    @Bean("documentIntelligenceWebClient")
    public WebClient documentIntelligenceWebClient() {
        log.info("Initializing Document Intelligence WebClient with base URL: {}", baseUrl);
        return WebClient.builder().baseUrl(baseUrl).build();
    }

    @Bean("documentIntelligenceAuthentication")
    public Authentication documentIntelligenceAuthentication() {
        if (headerValue == null || headerValue.isBlank()) {
            log.warn("Document Intelligence API key is not configured. OCR calls will fail authentication.");
        }
        return new APIKeyAuthentication(headerName, headerValue);
    }
}
