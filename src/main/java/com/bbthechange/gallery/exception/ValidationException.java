package com.bbthechange.gallery.exception;

/**
 * Malformed request input that bean validation cannot express.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
