package com.bbthechange.gallery.controller;

import com.bbthechange.gallery.dto.BulkEventActionRequest;
import com.bbthechange.gallery.dto.BulkItemResult;
import com.bbthechange.gallery.dto.CreateEventRequest;
import com.bbthechange.gallery.dto.EventDTO;
import com.bbthechange.gallery.dto.UpdateEventRequest;
import com.bbthechange.gallery.model.EventTransition;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.service.EventLifecycleService;
import com.bbthechange.gallery.util.PaginatedResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * Host management of events. Owners and admins may act on any event they can see.
 */
@RestController
@RequestMapping("/events")
@Tag(name = "Events", description = "Create, publish and manage photo events")
@SecurityRequirement(name = "Bearer Authentication")
public class EventController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    private final EventLifecycleService eventLifecycleService;

    @Autowired
    public EventController(EventLifecycleService eventLifecycleService) {
        this.eventLifecycleService = eventLifecycleService;
    }

    @PostMapping
    @Operation(summary = "Create event", description = "Creates a DRAFT event with a fresh share token")
    public ResponseEntity<EventDTO> createEvent(@Valid @RequestBody CreateEventRequest body,
                                                HttpServletRequest request) {
        EventDTO event = eventLifecycleService.create(extractActor(request), body);
        return ResponseEntity.status(HttpStatus.CREATED).body(event);
    }

    @GetMapping
    @Operation(summary = "List own events", description = "Newest first; deleted events are omitted")
    public ResponseEntity<PaginatedResult<EventDTO>> listEvents(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String nextToken,
            HttpServletRequest request) {
        return ResponseEntity.ok(eventLifecycleService.listOwn(extractActor(request), pageSize(limit), nextToken));
    }

    @GetMapping("/{eventId}")
    @Operation(summary = "Get event")
    public ResponseEntity<EventDTO> getEvent(@PathVariable String eventId, HttpServletRequest request) {
        return ResponseEntity.ok(eventLifecycleService.get(extractActor(request), eventId));
    }

    @PatchMapping("/{eventId}")
    @Operation(summary = "Update event metadata", description = "Only provided fields are changed")
    public ResponseEntity<EventDTO> updateEvent(@PathVariable String eventId,
                                                @Valid @RequestBody UpdateEventRequest body,
                                                HttpServletRequest request) {
        return ResponseEntity.ok(eventLifecycleService.updateMetadata(extractActor(request), eventId, body));
    }

    @DeleteMapping("/{eventId}")
    @Operation(summary = "Delete event", description = "Soft delete; the event can no longer be changed or viewed publicly")
    public ResponseEntity<EventDTO> deleteEvent(@PathVariable String eventId, HttpServletRequest request) {
        Actor actor = extractActor(request);
        EventDTO event = eventLifecycleService.transition(actor, eventId, EventTransition.DELETE);
        logger.info("Event {} deleted by {}", eventId, actor);
        return ResponseEntity.ok(event);
    }

    @PostMapping("/{eventId}/publish")
    @Operation(summary = "Publish event", description = "DRAFT to ACTIVE; opens the public share link")
    public ResponseEntity<EventDTO> publishEvent(@PathVariable String eventId, HttpServletRequest request) {
        return ResponseEntity.ok(eventLifecycleService.transition(extractActor(request), eventId, EventTransition.PUBLISH));
    }

    @PostMapping(value = "/{eventId}/cover", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload cover image", description = "Replaces the event cover image")
    public ResponseEntity<EventDTO> uploadCover(@PathVariable String eventId,
                                                @RequestParam("file") MultipartFile file,
                                                HttpServletRequest request) {
        return ResponseEntity.ok(eventLifecycleService.setCover(extractActor(request), eventId, file));
    }

    @PostMapping("/actions/bulk")
    @Operation(summary = "Bulk event action", description = "Applies publish or delete to each event independently")
    public ResponseEntity<List<BulkItemResult>> bulkAction(@Valid @RequestBody BulkEventActionRequest body,
                                                           HttpServletRequest request) {
        return ResponseEntity.ok(eventLifecycleService.bulk(
            extractActor(request), body.getAction(), body.getEventIds(), false));
    }
}
