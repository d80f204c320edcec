package com.bbthechange.gallery.repository;

import com.bbthechange.gallery.dto.PhotoStats;
import com.bbthechange.gallery.model.Photo;
import com.bbthechange.gallery.model.PhotoStatus;
import com.bbthechange.gallery.util.PaginatedResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Photo items live in their event's partition. Every write is conditioned on the owning
 * event in the same transaction.
 */
public interface PhotoRepository {

    /**
     * Insert a new photo while the owning event is ACTIVE.
     */
    ConditionalWriteResult create(Photo photo);

    Optional<Photo> findById(String eventId, String photoId);

    PaginatedResult<Photo> findByEvent(String eventId, PhotoStatus statusFilter, int limit, String nextToken);

    List<Photo> findAllByEvent(String eventId, PhotoStatus statusFilter);

    long countByEvent(String eventId, PhotoStatus statusFilter);

    ConditionalWriteResult transitionApproval(String eventId, String photoId, PhotoStatus expected,
                                              PhotoStatus target, String moderatedBy, Instant moderatedAt);

    ConditionalWriteResult updateCaption(String eventId, String photoId, String caption);

    ConditionalWriteResult delete(String eventId, String photoId, PhotoStatus expected);

    /**
     * Most recent uploads across all events.
     */
    List<Photo> findRecent(int limit);

    PhotoStats summarize();
}
