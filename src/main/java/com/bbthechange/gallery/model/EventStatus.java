package com.bbthechange.gallery.model;

/**
 * Lifecycle of an event. DELETED is terminal.
 */
public enum EventStatus {
    DRAFT,
    ACTIVE,
    SUSPENDED,
    DELETED;

    public boolean isTerminal() {
        return this == DELETED;
    }
}
