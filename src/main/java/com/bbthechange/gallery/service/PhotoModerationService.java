package com.bbthechange.gallery.service;

import com.bbthechange.gallery.dto.BulkItemResult;
import com.bbthechange.gallery.dto.PhotoDTO;
import com.bbthechange.gallery.dto.PublicPhotoDTO;
import com.bbthechange.gallery.dto.UpdatePhotoRequest;
import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.model.PhotoStatus;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.util.PaginatedResult;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * Photo approval state machine: PENDING -> APPROVED | REJECTED, APPROVED <-> REJECTED.
 * Removal is a hard delete. Every write is a compare-and-swap on the prior approval status,
 * checked together with the owning event in one transaction.
 */
public interface PhotoModerationService {

    /**
     * @throws com.bbthechange.gallery.exception.IllegalStateTransitionException when the transition is
     *         not allowed or another moderator changed the photo first
     */
    PhotoDTO moderate(Actor actor, String eventId, String photoId, PhotoStatus target);

    /**
     * Apply a caption change and/or a moderation decision.
     */
    PhotoDTO update(Actor actor, String eventId, String photoId, UpdatePhotoRequest request);

    void remove(Actor actor, String eventId, String photoId);

    List<BulkItemResult> bulkDelete(Actor actor, String eventId, List<String> photoIds);

    List<BulkItemResult> bulkModerate(Actor actor, String eventId, List<String> photoIds, PhotoStatus target);

    /**
     * All photos of an event for its owner or an admin, optionally filtered by approval status.
     */
    PaginatedResult<PhotoDTO> listForHost(Actor actor, String eventId, PhotoStatus statusFilter,
                                          int limit, String nextToken);

    /**
     * Store an anonymous upload as PENDING. The event must already have passed the share gate.
     *
     * @throws com.bbthechange.gallery.exception.QuotaExceededException if the host's storage quota is used up
     */
    PhotoDTO submitPublicPhoto(Event event, MultipartFile file, String caption);

    /**
     * Approved photos only, for visitors of a granted event.
     */
    PaginatedResult<PublicPhotoDTO> listApproved(Event event, int limit, String nextToken);
}
