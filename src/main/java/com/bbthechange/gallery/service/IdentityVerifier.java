package com.bbthechange.gallery.service;

import com.bbthechange.gallery.security.VerifiedIdentity;

/**
 * Validates an opaque bearer credential issued by the external identity provider.
 */
public interface IdentityVerifier {

    /**
     * @throws com.bbthechange.gallery.exception.InvalidCredentialException for any credential the provider rejects
     * @throws com.bbthechange.gallery.exception.IdentityProviderUnavailableException when signing keys cannot be fetched
     */
    VerifiedIdentity verify(String credential);
}
