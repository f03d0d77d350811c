package com.eyelevel.documentindexer.service.storage;

import java.net.URL;
import java.time.Duration;

/**
 * Object storage used by the pipeline. Locations are always {@code bucket/path} strings; phases never
 * touch the local filesystem directly.
 */
public interface StorageAccessor {

    byte[] read(String uri);

    /**
     * Stores {@code content} at {@code uri}, replacing any previous object.
     *
     * @return the URI the content was written to.
     */
    String write(String uri, byte[] content, String contentType);

    /**
     * Time-limited URL an external provider can use to fetch the object.
     */
    URL presignedReadUrl(String uri, Duration ttl);
}
