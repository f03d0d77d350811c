package com.eyelevel.documentindexer.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Optional;

/**
 * A successful (2xx) provider response. Error responses never reach callers as an
 * {@code ApiResponse}; they are raised as {@link com.eyelevel.documentindexer.exception.apiclient.ApiException}.
 */
@Builder
@Getter
public class ApiResponse {

    /**
     * Raw body. Empty, never null, when the provider sent no body (for example a 202 Accepted).
     */
    private final byte[] data;

    @Nullable
    private final MediaType contentType;

    private final HttpHeaders headers;

    private final int statusCode;

    private final Instant timestamp;

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers).map(h -> h.getFirst(name));
    }
}
