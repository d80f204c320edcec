package com.bbthechange.gallery.service.impl;

import com.bbthechange.gallery.config.IdentityProperties;
import com.bbthechange.gallery.exception.IdentityProviderUnavailableException;
import com.bbthechange.gallery.exception.InvalidCredentialException;
import com.bbthechange.gallery.security.VerifiedIdentity;
import com.bbthechange.gallery.service.IdentityVerifier;
import com.google.firebase.auth.AuthErrorCode;
import com.google.firebase.auth.FirebaseAuth;
import com.google.firebase.auth.FirebaseAuthException;
import com.google.firebase.auth.FirebaseToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;

/**
 * Verifies Firebase ID tokens. Only a failure to fetch Google's signing certificates is
 * retried; every other rejection is final and reported as an invalid credential.
 */
@Service
public class FirebaseIdentityVerifier implements IdentityVerifier {

    private static final Logger logger = LoggerFactory.getLogger(FirebaseIdentityVerifier.class);

    private final FirebaseAuth firebaseAuth;
    private final IdentityProperties identityProperties;

    @Autowired
    public FirebaseIdentityVerifier(FirebaseAuth firebaseAuth, IdentityProperties identityProperties) {
        this.firebaseAuth = firebaseAuth;
        this.identityProperties = identityProperties;
    }

    @Override
    public VerifiedIdentity verify(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new InvalidCredentialException("Missing credential");
        }

        int maxAttempts = Math.max(1, identityProperties.getMaxAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                FirebaseToken token = firebaseAuth.verifyIdToken(credential, identityProperties.isCheckRevoked());
                return toIdentity(token);

            } catch (FirebaseAuthException e) {
                if (e.getAuthErrorCode() != AuthErrorCode.CERTIFICATE_FETCH_FAILED) {
                    logger.warn("Rejected credential: code={}, message={}", e.getAuthErrorCode(), e.getMessage());
                    throw new InvalidCredentialException("Invalid credential", e);
                }
                if (attempt >= maxAttempts) {
                    logger.error("Identity provider keys unavailable after {} attempts", attempt);
                    throw new IdentityProviderUnavailableException("Identity provider unavailable", e);
                }
                logger.warn("Identity provider key fetch failed (attempt {}/{}), retrying", attempt, maxAttempts);
                backoff(attempt, e);

            } catch (IllegalArgumentException e) {
                // Thrown by the SDK for structurally malformed tokens
                logger.warn("Rejected malformed credential: {}", e.getMessage());
                throw new InvalidCredentialException("Invalid credential", e);
            }
        }
    }

    private VerifiedIdentity toIdentity(FirebaseToken token) {
        if (token.getEmail() == null || token.getEmail().isBlank()) {
            logger.warn("Rejected credential for subject {}: no email claim", token.getUid());
            throw new InvalidCredentialException("Credential carries no email");
        }
        Map<String, Object> claims = token.getClaims();
        return new VerifiedIdentity(
            token.getUid(),
            token.getEmail(),
            token.isEmailVerified(),
            token.getName(),
            epochSecondsClaim(claims, "iat"),
            epochSecondsClaim(claims, "exp")
        );
    }

    private static Instant epochSecondsClaim(Map<String, Object> claims, String name) {
        Object value = claims == null ? null : claims.get(name);
        return value instanceof Number ? Instant.ofEpochSecond(((Number) value).longValue()) : null;
    }

    private void backoff(int attempt, FirebaseAuthException cause) {
        long delayMs = identityProperties.getRetryBackoff().toMillis() * attempt;
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IdentityProviderUnavailableException("Interrupted while waiting to retry", cause);
        }
    }
}
