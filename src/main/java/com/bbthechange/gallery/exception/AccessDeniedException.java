package com.bbthechange.gallery.exception;

import com.bbthechange.gallery.security.DenyReason;

/**
 * An authenticated actor is not permitted to perform the operation.
 */
public class AccessDeniedException extends RuntimeException {

    private final DenyReason reason;

    public AccessDeniedException(DenyReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DenyReason getReason() {
        return reason;
    }
}
