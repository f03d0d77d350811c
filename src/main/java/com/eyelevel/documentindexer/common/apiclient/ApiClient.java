package com.eyelevel.documentindexer.common.apiclient;

import com.eyelevel.documentindexer.common.apiclient.authentication.Authentication;
import com.eyelevel.documentindexer.common.apiclient.model.ApiRequest;
import com.eyelevel.documentindexer.common.apiclient.model.ApiResponse;
import com.eyelevel.documentindexer.exception.apiclient.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.*;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Base class for the provider clients. Sends an {@link ApiRequest} through a {@link WebClient},
 * blocks for the response within a per-client timeout and translates every failure into the
 * {@link ApiException} hierarchy, so retry policies can be declared against exception types.
 */
@Slf4j
public abstract class ApiClient {

    protected final WebClient webClient;
    protected final Authentication authentication;
    private final Duration timeout;

    protected ApiClient(WebClient webClient, Authentication authentication, Duration timeout) {
        this.webClient = webClient;
        this.authentication = authentication;
        this.timeout = timeout;
    }

    /**
     * Executes the request and returns the successful response.
     *
     * @throws ApiException for non-2xx statuses, connection failures and timeouts.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.debug("Calling {} {}", apiRequest.getMethod(), apiRequest.describeTarget());

        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            ApiResponse apiResponse = requestBodySpec.exchangeToMono(this::handleResponse)
                                                     .timeout(timeout)
                                                     .onErrorMap(this::mapException)
                                                     .block();
            log.debug("{} {} answered with status {}", apiRequest.getMethod(), apiRequest.describeTarget(),
                      apiResponse == null ? "none" : apiResponse.getStatusCode());
            return apiResponse;
        } catch (ApiException e) {
            log.warn("{} {} failed with status {}: {}", apiRequest.getMethod(), apiRequest.describeTarget(),
                     e.getStatusCode(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Unexpected error calling {} {}", apiRequest.getMethod(), apiRequest.describeTarget(), e);
            throw mapException(e);
        }
    }

    private RuntimeException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        if (error instanceof WebClientResponseException webClientError) {
            return createException(webClientError.getResponseBodyAsString(), webClientError.getStatusCode().value());
        }
        if (error instanceof WebClientRequestException || error instanceof ConnectException
            || error instanceof UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to external service: " + error.getMessage());
        }
        if (error instanceof TimeoutException) {
            return new GatewayTimeoutException("Request timed out after " + timeout.toMillis() + " ms");
        }
        if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());
        }
        return new ApiException("Internal API client error: " + error.getMessage(),
                                HttpStatus.INTERNAL_SERVER_ERROR.value());
    }

    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        WebClient.RequestBodyUriSpec uriSpec = webClient.method(apiRequest.getMethod());
        if (apiRequest.getAbsoluteUri() != null) {
            return uriSpec.uri(apiRequest.getAbsoluteUri());
        }
        return uriSpec.uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());
            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach(uriBuilder::queryParam));
            return uriBuilder.build(Optional.ofNullable(apiRequest.getPathVariables()).orElse(Collections.emptyMap()));
        });
    }

    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        Map<String, String> headers = new HashMap<>(Optional.ofNullable(apiRequest.getHeaders()).orElse(Map.of()));
        authentication.applyAuthentication(headers);
        headers.forEach(requestBodySpec::header);
        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }
        MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        try {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        } catch (Exception e) {
            log.error("Invalid request body for {}: {}", apiRequest.describeTarget(), e.getMessage());
            throw new BadRequestException("Invalid request body: " + e.getMessage());
        }
    }

    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        int statusCode = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            HttpHeaders headers = response.headers().asHttpHeaders();
            return response.bodyToMono(byte[].class)
                           .defaultIfEmpty(new byte[0])
                           .map(data -> ApiResponse.builder()
                                                   .data(data)
                                                   .contentType(headers.getContentType())
                                                   .headers(headers)
                                                   .statusCode(statusCode)
                                                   .timestamp(Instant.now())
                                                   .build());
        }
        return response.bodyToMono(String.class)
                       .defaultIfEmpty("")
                       .flatMap(body -> Mono.error(createException(body, statusCode)));
    }

    private ApiException createException(String body, int statusCode) {
        String message = body == null || body.isBlank() ? "HTTP " + statusCode : body;
        return switch (statusCode) {
            case 400 -> new BadRequestException(message);
            case 401 -> new UnauthorizedException(message);
            case 403 -> new ForbiddenException(message);
            case 404 -> new NotFoundException(message);
            case 409 -> new ConflictException(message);
            case 429 -> new TooManyRequestsException(message);
            case 500 -> new InternalServerException(message);
            case 502 -> new BadGatewayException(message);
            case 503 -> new ServiceUnavailableException(message);
            case 504 -> new GatewayTimeoutException(message);
            default -> new ApiException(message, statusCode);
        };
    }
}
