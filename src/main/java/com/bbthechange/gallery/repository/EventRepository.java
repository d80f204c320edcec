package com.bbthechange.gallery.repository;

import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.model.EventStatus;
import com.bbthechange.gallery.util.PaginatedResult;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface EventRepository {

    void create(Event event);

    Optional<Event> findById(String eventId);

    Optional<Event> findByShareToken(String shareToken);

    boolean shareTokenExists(String shareToken);

    /**
     * Events of one host, newest first, via HostIndex.
     */
    PaginatedResult<Event> findByHostId(String hostId, boolean includeDeleted, int limit, String nextToken);

    /**
     * Compare-and-swap on the event status.
     *
     * @return false if the stored status is no longer {@code expected} or the event is gone
     */
    boolean transitionStatus(String eventId, EventStatus expected, EventStatus target);

    /**
     * Set only the given metadata attributes (title, description, date, password hash, cover) if the
     * status is still {@code expected}. A value with {@code nul(true)} removes the attribute.
     *
     * @return false if the stored status is no longer {@code expected} or the event is gone
     */
    boolean updateMetadata(String eventId, EventStatus expected, Map<String, AttributeValue> updates);

    /**
     * Hard-delete the event if its status is still {@code expected}, then purge every photo and
     * export item in its partition.
     *
     * @return storage references of the purged items, or empty if the status changed
     */
    Optional<List<String>> forceDelete(String eventId, EventStatus expected);

    PaginatedResult<Event> findAll(EventStatus statusFilter, int limit, String nextToken);

    Map<EventStatus, Long> countByStatus();
}
