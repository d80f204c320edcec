package com.bbthechange.gallery.security;

/**
 * Why the authorization guard refused an operation.
 */
public enum DenyReason {
    NOT_OWNER,
    HOST_SUSPENDED,
    ADMIN_REQUIRED
}
