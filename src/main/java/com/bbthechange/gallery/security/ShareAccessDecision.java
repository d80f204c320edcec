package com.bbthechange.gallery.security;

import com.bbthechange.gallery.exception.ShareAccessDeniedException;
import com.bbthechange.gallery.model.Event;

/**
 * Outcome of a public share-token check: granted with the event, or denied with a reason.
 */
public final class ShareAccessDecision {

    private final Event event;
    private final ShareDenial denial;

    private ShareAccessDecision(Event event, ShareDenial denial) {
        this.event = event;
        this.denial = denial;
    }

    public static ShareAccessDecision granted(Event event) {
        return new ShareAccessDecision(event, null);
    }

    public static ShareAccessDecision denied(ShareDenial denial) {
        return new ShareAccessDecision(null, denial);
    }

    public boolean isGranted() {
        return denial == null;
    }

    public ShareDenial getDenial() {
        return denial;
    }

    public Event orThrow() {
        if (denial != null) {
            throw new ShareAccessDeniedException(denial);
        }
        return event;
    }

    @Override
    public String toString() {
        return isGranted() ? "Granted(" + event.getEventId() + ")" : "Denied(" + denial + ")";
    }
}
