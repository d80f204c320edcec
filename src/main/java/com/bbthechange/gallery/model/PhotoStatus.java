package com.bbthechange.gallery.model;

/**
 * Approval state of a photo. Every photo starts PENDING; a moderator may move it to
 * APPROVED or REJECTED and later flip between those two.
 */
public enum PhotoStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public boolean canTransitionTo(PhotoStatus target) {
        return switch (this) {
            case PENDING -> target == APPROVED || target == REJECTED;
            case APPROVED -> target == REJECTED;
            case REJECTED -> target == APPROVED;
        };
    }
}
