package com.bbthechange.gallery.security;

import java.time.Instant;

/**
 * Claims extracted from a credential the identity provider vouched for.
 */
public final class VerifiedIdentity {

    private final String subjectId;
    private final String email;
    private final boolean emailVerified;
    private final String displayName;
    private final Instant issuedAt;
    private final Instant expiry;

    public VerifiedIdentity(String subjectId, String email, boolean emailVerified, String displayName,
                            Instant issuedAt, Instant expiry) {
        this.subjectId = subjectId;
        this.email = email;
        this.emailVerified = emailVerified;
        this.displayName = displayName;
        this.issuedAt = issuedAt;
        this.expiry = expiry;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getEmail() {
        return email;
    }

    public boolean isEmailVerified() {
        return emailVerified;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public Instant getExpiry() {
        return expiry;
    }
}
