package com.bbthechange.gallery.security;

/**
 * Why a public visitor was turned away from a shared event.
 */
public enum ShareDenial {
    NOT_AVAILABLE,
    WRONG_PASSWORD
}
