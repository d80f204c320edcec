package com.bbthechange.gallery.exception;

import com.bbthechange.gallery.security.ShareDenial;

/**
 * A public visitor cannot reach the shared event.
 */
public class ShareAccessDeniedException extends RuntimeException {

    private final ShareDenial denial;

    public ShareAccessDeniedException(ShareDenial denial) {
        super(denial == ShareDenial.WRONG_PASSWORD ? "Incorrect event password" : "Event not available");
        this.denial = denial;
    }

    public ShareDenial getDenial() {
        return denial;
    }
}
