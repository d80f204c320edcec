package com.bbthechange.gallery.service;

import com.bbthechange.gallery.dto.ExportJobDTO;
import com.bbthechange.gallery.security.Actor;

/**
 * ZIP export of an event's approved photos, submitted and then polled.
 */
public interface ExportJobService {

    /**
     * Queue an export. Packaging runs in the background.
     */
    ExportJobDTO submit(Actor actor, String eventId);

    /**
     * Current job state; a completed job carries a fresh download URL.
     */
    ExportJobDTO get(Actor actor, String eventId, String jobId);
}
