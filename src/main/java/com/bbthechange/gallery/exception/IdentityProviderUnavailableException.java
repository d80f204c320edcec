package com.bbthechange.gallery.exception;

/**
 * The identity provider's signing keys could not be fetched after all retry attempts.
 */
public class IdentityProviderUnavailableException extends RuntimeException {

    public IdentityProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
