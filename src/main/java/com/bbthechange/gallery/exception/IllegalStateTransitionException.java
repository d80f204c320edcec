package com.bbthechange.gallery.exception;

/**
 * Requested transition is not legal from the current state, the target is deleted,
 * or the stored state changed since it was read.
 */
public class IllegalStateTransitionException extends RuntimeException {

    public IllegalStateTransitionException(String message) {
        super(message);
    }
}
