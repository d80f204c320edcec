package com.bbthechange.gallery.exception;

/**
 * Accepting an upload would push the host past its storage quota.
 */
public class QuotaExceededException extends RuntimeException {

    public QuotaExceededException(String message) {
        super(message);
    }
}
