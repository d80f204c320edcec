package com.bbthechange.gallery.dto;

/**
 * Per-item result of a bulk operation.
 */
public enum BulkOutcome {
    APPLIED,
    REMOVED,
    NOT_FOUND,
    ILLEGAL_STATE,
    NOT_OWNER,
    HOST_SUSPENDED,
    ADMIN_REQUIRED,
    // Storage or database error on this item; the rest of the batch still runs.
    FAILED
}
