package com.eyelevel.documentindexer.common.apiclient.authentication.impl;

import com.eyelevel.documentindexer.common.apiclient.authentication.Authentication;
import org.springframework.http.HttpHeaders;

import java.util.Map;

/**
 * Sends {@code Authorization: Bearer <token>}, as expected by OpenAI-compatible APIs.
 */
public record BearerTokenAuthentication(String token) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + token);
    }

    @Override
    public String toString() {
        return "BearerTokenAuthentication[token=***]";
    }
}
