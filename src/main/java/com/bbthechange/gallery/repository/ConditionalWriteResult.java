package com.bbthechange.gallery.repository;

/**
 * Outcome of a compare-and-swap write.
 */
public enum ConditionalWriteResult {
    /** The write happened. */
    APPLIED,
    /** The item was missing or its state no longer matched the expected value. */
    STALE,
    /** The owning event is gone or no longer in a state that permits the write. */
    PARENT_UNAVAILABLE
}
