package com.bbthechange.gallery.service;

import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.security.AuthorizationDecision;
import com.bbthechange.gallery.security.OperationKind;

/**
 * Ownership and role rules. State legality is left to the state machines.
 */
public interface AuthorizationGuard {

    /**
     * Rules, first match wins: admin allows; a non-owner is denied NOT_OWNER; a suspended
     * owner is denied HOST_SUSPENDED; an admin-only operation is denied ADMIN_REQUIRED;
     * otherwise allow. Photo operations pass the owning event.
     */
    AuthorizationDecision check(Actor actor, OperationKind operation, Event event);

    /**
     * Host-only operations that do not target an event (creating events, editing the profile).
     *
     * @throws com.bbthechange.gallery.exception.AccessDeniedException with HOST_SUSPENDED
     */
    void requireActiveHost(Actor actor);

    /**
     * @throws com.bbthechange.gallery.exception.AccessDeniedException with ADMIN_REQUIRED
     */
    void requireAdmin(Actor actor);
}
