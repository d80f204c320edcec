package com.bbthechange.gallery.service;

import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.security.VerifiedIdentity;

/**
 * Maps a verified identity onto the local host record and the admin allow-list.
 */
public interface ActorResolver {

    /**
     * Attach the host for this identity's subject, creating it on first sight.
     * Resolving the same identity twice always yields the same host id.
     */
    Actor resolve(VerifiedIdentity identity);
}
