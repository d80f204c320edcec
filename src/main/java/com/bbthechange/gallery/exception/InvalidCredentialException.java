package com.bbthechange.gallery.exception;

/**
 * The bearer credential was malformed, badly signed, expired, revoked or otherwise unusable.
 * Clients always see the same 401; the cause is only logged.
 */
public class InvalidCredentialException extends RuntimeException {

    public InvalidCredentialException(String message) {
        super(message);
    }

    public InvalidCredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
