package com.eyelevel.documentindexer.common.apiclient.authentication.impl;

import com.eyelevel.documentindexer.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Sends a static API key in a provider-specific header, such as {@code Ocp-Apim-Subscription-Key}.
 */
@Slf4j
public record APIKeyAuthentication(String headerName, String apiKey) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        log.trace("Applying API key authentication using header '{}'", headerName);
        headers.put(headerName, apiKey);
    }

    @Override
    public String toString() {
        return "APIKeyAuthentication[headerName=" + headerName + "]";
    }
}
