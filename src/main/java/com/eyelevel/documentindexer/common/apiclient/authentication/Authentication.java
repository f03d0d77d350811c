package com.eyelevel.documentindexer.common.apiclient.authentication;

import java.util.Map;

/**
 * Applies a provider's authentication scheme to the headers of an outgoing request.
 */
public interface Authentication {

    /**
     * @param headers mutable header map of the request being prepared.
     */
    void applyAuthentication(Map<String, String> headers);
}
