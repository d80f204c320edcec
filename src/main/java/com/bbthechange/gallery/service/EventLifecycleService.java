package com.bbthechange.gallery.service;

import com.bbthechange.gallery.dto.BulkItemResult;
import com.bbthechange.gallery.dto.CreateEventRequest;
import com.bbthechange.gallery.dto.EventDTO;
import com.bbthechange.gallery.dto.UpdateEventRequest;
import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.model.EventStatus;
import com.bbthechange.gallery.model.EventTransition;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.security.OperationKind;
import com.bbthechange.gallery.util.PaginatedResult;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * Event state machine and metadata mutation.
 *
 * DRAFT -> ACTIVE (publish), ACTIVE <-> SUSPENDED (admin), any live state -> DELETED (soft delete),
 * any live state -> removed (admin force delete). DELETED is terminal.
 */
public interface EventLifecycleService {

    /**
     * Bulk action names accepted from hosts.
     */
    List<String> HOST_BULK_ACTIONS = List.of("publish", "delete");

    /**
     * Bulk action names accepted from admins.
     */
    List<String> ADMIN_BULK_ACTIONS = List.of("suspend", "reactivate", "delete", "force-delete");

    EventDTO create(Actor actor, CreateEventRequest request);

    /**
     * The caller's own events, newest first. DELETED events are left out.
     */
    PaginatedResult<EventDTO> listOwn(Actor actor, int limit, String nextToken);

    EventDTO get(Actor actor, String eventId);

    EventDTO updateMetadata(Actor actor, String eventId, UpdateEventRequest request);

    EventDTO setCover(Actor actor, String eventId, MultipartFile file);

    /**
     * Apply a status transition with compare-and-swap on the observed status.
     *
     * @throws com.bbthechange.gallery.exception.IllegalStateTransitionException if the transition is
     *         not allowed from the current status or the status changed concurrently
     */
    EventDTO transition(Actor actor, String eventId, EventTransition transition);

    /**
     * Admin hard delete of the event with every photo and export in it.
     */
    void forceDelete(Actor actor, String eventId);

    /**
     * Apply one action to many events independently. Already-applied items are never rolled back.
     *
     * @param adminSurface whether the request came through the admin API, which selects the accepted actions
     * @throws com.bbthechange.gallery.exception.ValidationException for an empty id list or unknown action
     */
    List<BulkItemResult> bulk(Actor actor, String action, List<String> eventIds, boolean adminSurface);

    /**
     * Every event in the system, optionally filtered by status. Admin only.
     */
    PaginatedResult<EventDTO> listAll(Actor actor, EventStatus statusFilter, int limit, String nextToken);

    /**
     * Load an event and authorize the actor for an operation on it. A DELETED event is an illegal
     * state for its owner and admins and does not exist for anyone else.
     */
    Event requireAccessible(Actor actor, String eventId, OperationKind operation);
}
