package com.bbthechange.gallery.service.impl;

import com.bbthechange.gallery.exception.AccessDeniedException;
import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.security.AuthorizationDecision;
import com.bbthechange.gallery.security.DenyReason;
import com.bbthechange.gallery.security.OperationKind;
import com.bbthechange.gallery.service.AuthorizationGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AuthorizationGuardImpl implements AuthorizationGuard {

    private static final Logger logger = LoggerFactory.getLogger(AuthorizationGuardImpl.class);

    @Override
    public AuthorizationDecision check(Actor actor, OperationKind operation, Event event) {
        AuthorizationDecision decision = decide(actor, operation, event);
        if (!decision.isAllowed()) {
            logger.info("Denied {} on event {} for {}: {}",
                operation, event.getEventId(), actor, decision.getReason());
        }
        return decision;
    }

    private AuthorizationDecision decide(Actor actor, OperationKind operation, Event event) {
        if (actor.isAdmin()) {
            return AuthorizationDecision.allow();
        }
        if (!event.isOwnedBy(actor.getHostId())) {
            return AuthorizationDecision.deny(DenyReason.NOT_OWNER);
        }
        if (actor.isSuspended()) {
            return AuthorizationDecision.deny(DenyReason.HOST_SUSPENDED);
        }
        if (operation.isAdminOnly()) {
            return AuthorizationDecision.deny(DenyReason.ADMIN_REQUIRED);
        }
        return AuthorizationDecision.allow();
    }

    @Override
    public void requireActiveHost(Actor actor) {
        if (actor.isSuspended()) {
            logger.info("Denied host-only operation for suspended {}", actor);
            throw new AccessDeniedException(DenyReason.HOST_SUSPENDED, "Host account is suspended");
        }
    }

    @Override
    public void requireAdmin(Actor actor) {
        if (!actor.isAdmin()) {
            logger.info("Denied admin operation for {}", actor);
            throw new AccessDeniedException(DenyReason.ADMIN_REQUIRED, "Administrator access required");
        }
    }
}
