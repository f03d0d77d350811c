package com.eyelevel.documentindexer.service.storage;

import com.eyelevel.documentindexer.exception.StorageAccessException;

/**
 * A {@code bucket/path} storage location. The first segment is the bucket, the rest is the object key.
 */
public record StorageUri(String bucket, String key) {

    public StorageUri {
        if (bucket == null || bucket.isBlank() || key == null || key.isBlank()) {
            throw new StorageAccessException("Storage URI needs both a bucket and a key");
        }
    }

    /**
     * @throws StorageAccessException if the value is not of the form {@code bucket/path}.
     */
    public static StorageUri parse(String uri) {
        if (uri == null) {
            throw new StorageAccessException("Storage URI must not be null");
        }
        int slash = uri.indexOf('/');
        if (slash <= 0 || slash == uri.length() - 1) {
            throw new StorageAccessException("Invalid storage URI '" + uri + "'. Expected 'bucket/path'");
        }
        return new StorageUri(uri.substring(0, slash), uri.substring(slash + 1));
    }

    public static boolean isValid(String uri) {
        if (uri == null) {
            return false;
        }
        int slash = uri.indexOf('/');
        return slash > 0 && slash < uri.length() - 1 && !uri.isBlank();
    }

    @Override
    public String toString() {
        return bucket + "/" + key;
    }
}
