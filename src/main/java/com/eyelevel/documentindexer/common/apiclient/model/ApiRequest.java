package com.eyelevel.documentindexer.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.net.URI;
import java.util.Map;

/**
 * Everything needed to send one HTTP request to a provider.
 *
 * <p>A request normally targets {@code path} relative to the client's base URL. Polling endpoints
 * handed back by a provider (for example an {@code Operation-Location} header) are absolute, so
 * {@code absoluteUri} takes precedence over {@code path} when it is set.
 */
@Builder
@Data
public class ApiRequest {

    private final HttpMethod method;

    /**
     * Path relative to the client's base URL. May contain {@code {placeholders}} resolved from
     * {@link #pathVariables}.
     */
    @Nullable
    private final String path;

    @Nullable
    private final URI absoluteUri;

    @Nullable
    private final Map<String, Object> queryParams;

    @Nullable
    private final Map<String, Object> pathVariables;

    /**
     * Per-request headers. Authentication headers are added on top of a copy of this map.
     */
    @Nullable
    private final Map<String, String> headers;

    /**
     * Serialized with the client's codecs, JSON unless {@link #contentType} says otherwise.
     */
    @Nullable
    private final Object body;

    @Nullable
    private final MediaType acceptMediaType;

    @Nullable
    private final MediaType contentType;

    /**
     * Short description used in log lines instead of the full URI.
     */
    public String describeTarget() {
        return absoluteUri != null ? absoluteUri.getPath() : path;
    }
}
