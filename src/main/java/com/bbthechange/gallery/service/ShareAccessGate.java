package com.bbthechange.gallery.service;

import com.bbthechange.gallery.dto.PublicEventInfo;
import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.security.ShareAccessDecision;

/**
 * Anonymous visitor access to a shared event.
 */
public interface ShareAccessGate {

    /**
     * Unknown tokens and events that are not ACTIVE are NOT_AVAILABLE. When the event has a
     * password the supplied one must match, otherwise WRONG_PASSWORD.
     */
    ShareAccessDecision evaluate(String shareToken, String password);

    /**
     * Access check for a public upload. The password is only required when uploads are gated.
     */
    Event requireUploadAccess(String shareToken, String password);

    /**
     * Landing-page information. Needs an ACTIVE event but no password.
     */
    PublicEventInfo publicInfo(String shareToken);
}
