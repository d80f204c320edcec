package com.bbthechange.gallery.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status-changing operations on an event and the states each may start from.
 */
public enum EventTransition {
    PUBLISH(EnumSet.of(EventStatus.DRAFT), EventStatus.ACTIVE),
    SUSPEND(EnumSet.of(EventStatus.ACTIVE), EventStatus.SUSPENDED),
    REACTIVATE(EnumSet.of(EventStatus.SUSPENDED), EventStatus.ACTIVE),
    DELETE(EnumSet.of(EventStatus.DRAFT, EventStatus.ACTIVE, EventStatus.SUSPENDED), EventStatus.DELETED),
    // Target is unused: force-delete removes the item. Soft-deleted events can still be purged.
    FORCE_DELETE(EnumSet.allOf(EventStatus.class), EventStatus.DELETED);

    private final Set<EventStatus> allowedFrom;
    private final EventStatus target;

    EventTransition(Set<EventStatus> allowedFrom, EventStatus target) {
        this.allowedFrom = allowedFrom;
        this.target = target;
    }

    public boolean isAllowedFrom(EventStatus current) {
        return allowedFrom.contains(current);
    }

    public EventStatus getTarget() {
        return target;
    }
}
