package com.eyelevel.documentindexer.common.apiclient.ocr;

import com.eyelevel.documentindexer.common.apiclient.ApiClient;
import com.eyelevel.documentindexer.common.apiclient.authentication.Authentication;
import com.eyelevel.documentindexer.common.apiclient.model.ApiRequest;
import com.eyelevel.documentindexer.common.apiclient.model.ApiResponse;
import com.eyelevel.documentindexer.common.apiclient.ocr.model.AnalyzeOperationResponse;
import com.eyelevel.documentindexer.common.json.JsonParser;
import com.eyelevel.documentindexer.exception.OcrAnalysisException;
import com.eyelevel.documentindexer.exception.apiclient.BadGatewayException;
import com.eyelevel.documentindexer.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.documentindexer.exception.apiclient.InternalServerException;
import com.eyelevel.documentindexer.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.documentindexer.exception.apiclient.TooManyRequestsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * REST client for Azure Document Intelligence. Analysis is asynchronous: {@link #startAnalysis}
 * returns the operation URL, which is then polled with {@link #fetchAnalysis}. Both calls retry
 * rate limits, server errors and timeouts with exponential backoff.
 */
@Slf4j
@Service("documentIntelligenceApiClient")
public class DocumentIntelligenceApiClient extends ApiClient {

    static final String OPERATION_LOCATION = "Operation-Location";

    private final JsonParser jsonParser;
    private final String apiVersion;
    private final String analyzeEndpoint;

    public DocumentIntelligenceApiClient(
            @Qualifier("documentIntelligenceWebClient") final WebClient webClient,
            @Qualifier("documentIntelligenceAuthentication") final Authentication authentication,
            @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
            @Value("${app.ocr-client.api-version:2024-07-31-preview}") final String apiVersion,
            @Value("${app.ocr-client.endpoint.analyze:/documentintelligence/documentModels/{modelId}:analyze}")
            final String analyzeEndpoint,
            @Value("${app.ocr-client.request-timeout-seconds:30}") final long requestTimeoutSeconds) {
        super(webClient, authentication, Duration.ofSeconds(requestTimeoutSeconds));
        this.jsonParser = jsonParser;
        this.apiVersion = apiVersion;
        this.analyzeEndpoint = analyzeEndpoint;
    }

    /**
     * Submits a document for analysis.
     *
     * @param modelId     provider model, e.g. {@code prebuilt-read}.
     * @param documentUrl URL the provider downloads the document from.
     * @return the operation URL to poll.
     */
    @Retryable(retryFor = {TooManyRequestsException.class, InternalServerException.class, BadGatewayException.class,
                           ServiceUnavailableException.class, GatewayTimeoutException.class},
               maxAttemptsExpression = "#{${app.indexing.retry.attempts:3}}",
               backoff = @Backoff(delayExpression = "#{${app.indexing.retry.initial-delay-ms:1000}}",
                                  multiplierExpression = "#{${app.indexing.retry.multiplier:2.0}}"),
               listeners = {"documentIntelligenceRetryListener"})
    public URI startAnalysis(final String modelId, final String documentUrl) {
        log.info("Submitting document to Azure Document Intelligence with model '{}'.", modelId);
        ApiRequest apiRequest = ApiRequest.builder()
                                          .method(HttpMethod.POST)
                                          .path(analyzeEndpoint)
                                          .pathVariables(Map.of("modelId", modelId))
                                          .queryParams(Map.of("api-version", apiVersion))
                                          .body(Map.of("urlSource", documentUrl))
                                          .contentType(MediaType.APPLICATION_JSON)
                                          .acceptMediaType(MediaType.APPLICATION_JSON)
                                          .build();
        ApiResponse apiResponse = call(apiRequest);
        String operationLocation = apiResponse.header(OPERATION_LOCATION)
                                              .orElseThrow(() -> new OcrAnalysisException(
                                                      "Analyze response carried no " + OPERATION_LOCATION + " header"));
        log.debug("Analysis accepted, polling {}", operationLocation);
        return URI.create(operationLocation);
    }

    /**
     * Reads the current state of an analysis operation.
     */
    @Retryable(retryFor = {TooManyRequestsException.class, InternalServerException.class, BadGatewayException.class,
                           ServiceUnavailableException.class, GatewayTimeoutException.class},
               maxAttemptsExpression = "#{${app.indexing.retry.attempts:3}}",
               backoff = @Backoff(delayExpression = "#{${app.indexing.retry.initial-delay-ms:1000}}",
                                  multiplierExpression = "#{${app.indexing.retry.multiplier:2.0}}"),
               listeners = {"documentIntelligenceRetryListener"})
    public AnalyzeOperationResponse fetchAnalysis(final URI operationLocation) {
        ApiRequest apiRequest = ApiRequest.builder()
                                          .method(HttpMethod.GET)
                                          .absoluteUri(operationLocation)
                                          .acceptMediaType(MediaType.APPLICATION_JSON)
                                          .build();
        ApiResponse apiResponse = call(apiRequest);
        return jsonParser.parseObject(apiResponse.getData(), AnalyzeOperationResponse.class);
    }

    @Recover
    public URI recoverStart(RuntimeException e, String modelId, String documentUrl) {
        log.error("Azure Document Intelligence rejected analysis with model '{}' after all retry attempts.", modelId, e);
        throw e;
    }

    @Recover
    public AnalyzeOperationResponse recoverFetch(RuntimeException e, URI operationLocation) {
        log.error("Polling Azure Document Intelligence operation {} failed after all retry attempts.",
                  operationLocation.getPath(), e);
        throw e;
    }
}
