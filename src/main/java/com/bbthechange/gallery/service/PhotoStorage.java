package com.bbthechange.gallery.service;

import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Object storage for photo files, cover images and export archives. Keys are opaque to callers.
 */
public interface PhotoStorage {

    void put(String key, InputStream content, long contentLength, String contentType);

    void putFile(String key, Path file, String contentType);

    InputStream open(String key);

    /**
     * Best effort: failures are logged, never thrown.
     */
    void delete(String key);

    String presignedGetUrl(String key, Duration ttl);
}
