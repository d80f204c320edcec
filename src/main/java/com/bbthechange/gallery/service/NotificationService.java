package com.bbthechange.gallery.service;

import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.model.ExportJob;
import com.bbthechange.gallery.model.Host;
import com.bbthechange.gallery.model.Photo;
import com.bbthechange.gallery.security.Actor;

/**
 * Emits notification signals. Delivery happens asynchronously and never fails the caller.
 */
public interface NotificationService {

    /**
     * A host record was created on first sign-in.
     */
    void notifyHostWelcomed(Host host);

    /**
     * A photo was approved or rejected. The event host is told only when someone else
     * (an admin) made the decision.
     */
    void notifyPhotoModerated(Event event, Photo photo, Actor moderator);

    /**
     * An export archive finished packaging.
     */
    void notifyExportReady(Event event, ExportJob job);
}
