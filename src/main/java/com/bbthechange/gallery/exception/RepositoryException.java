package com.bbthechange.gallery.exception;

/**
 * Wraps lower-level DynamoDB failures with a meaningful message.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
