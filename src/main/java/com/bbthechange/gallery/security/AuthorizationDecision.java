package com.bbthechange.gallery.security;

import com.bbthechange.gallery.exception.AccessDeniedException;

/**
 * Outcome of an authorization check: allow, or deny with a reason.
 */
public final class AuthorizationDecision {

    private static final AuthorizationDecision ALLOW = new AuthorizationDecision(null);

    private final DenyReason reason;

    private AuthorizationDecision(DenyReason reason) {
        this.reason = reason;
    }

    public static AuthorizationDecision allow() {
        return ALLOW;
    }

    public static AuthorizationDecision deny(DenyReason reason) {
        return new AuthorizationDecision(reason);
    }

    public boolean isAllowed() {
        return reason == null;
    }

    /**
     * @return the deny reason, or null when allowed
     */
    public DenyReason getReason() {
        return reason;
    }

    public void orThrow() {
        if (reason != null) {
            throw new AccessDeniedException(reason, "Operation denied: " + reason);
        }
    }

    @Override
    public String toString() {
        return isAllowed() ? "Allow" : "Deny(" + reason + ")";
    }
}
