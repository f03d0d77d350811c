package com.eyelevel.documentindexer.common.apiclient.embedding;

import com.eyelevel.documentindexer.common.apiclient.ApiClient;
import com.eyelevel.documentindexer.common.apiclient.authentication.Authentication;
import com.eyelevel.documentindexer.common.apiclient.embedding.model.EmbeddingRequest;
import com.eyelevel.documentindexer.common.apiclient.embedding.model.EmbeddingResponse;
import com.eyelevel.documentindexer.common.apiclient.model.ApiRequest;
import com.eyelevel.documentindexer.common.apiclient.model.ApiResponse;
import com.eyelevel.documentindexer.common.json.JsonParser;
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

import java.time.Duration;
import java.util.List;

/**
 * REST client for an OpenAI-compatible embeddings endpoint.
 */
@Slf4j
@Service("openAiEmbeddingApiClient")
public class OpenAiEmbeddingApiClient extends ApiClient {

    private final JsonParser jsonParser;
    private final String embeddingsEndpoint;

    public OpenAiEmbeddingApiClient(
            @Qualifier("embeddingWebClient") final WebClient webClient,
            @Qualifier("embeddingAuthentication") final Authentication authentication,
            @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
            @Value("${app.embedding-client.endpoint.embeddings:/v1/embeddings}") final String embeddingsEndpoint,
            @Value("${app.embedding-client.request-timeout-seconds:60}") final long requestTimeoutSeconds) {
        super(webClient, authentication, Duration.ofSeconds(requestTimeoutSeconds));
        this.jsonParser = jsonParser;
        this.embeddingsEndpoint = embeddingsEndpoint;
    }

    @Retryable(retryFor = {TooManyRequestsException.class, InternalServerException.class, BadGatewayException.class,
                           ServiceUnavailableException.class, GatewayTimeoutException.class},
               maxAttemptsExpression = "#{${app.indexing.retry.attempts:3}}",
               backoff = @Backoff(delayExpression = "#{${app.indexing.retry.initial-delay-ms:1000}}",
                                  multiplierExpression = "#{${app.indexing.retry.multiplier:2.0}}"),
               listeners = {"embeddingRetryListener"})
    public EmbeddingResponse createEmbeddings(final List<String> texts, final String model, final int dimensions) {
        log.info("Requesting {} embeddings from model '{}' ({} dimensions).", texts.size(), model, dimensions);
        ApiRequest apiRequest = ApiRequest.builder()
                                          .method(HttpMethod.POST)
                                          .path(embeddingsEndpoint)
                                          .body(new EmbeddingRequest(texts, model, dimensions))
                                          .contentType(MediaType.APPLICATION_JSON)
                                          .acceptMediaType(MediaType.APPLICATION_JSON)
                                          .build();
        ApiResponse apiResponse = call(apiRequest);
        return jsonParser.parseObject(apiResponse.getData(), EmbeddingResponse.class);
    }

    @Recover
    public EmbeddingResponse recover(RuntimeException e, List<String> texts, String model, int dimensions) {
        log.error("Embedding request for {} texts with model '{}' failed after all retry attempts.", texts.size(),
                  model, e);
        throw e;
    }
}
