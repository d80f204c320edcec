package com.bbthechange.gallery.controller;

import com.bbthechange.gallery.dto.*;
import com.bbthechange.gallery.exception.ValidationException;
import com.bbthechange.gallery.model.EventStatus;
import com.bbthechange.gallery.model.EventTransition;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.service.AdminOverviewService;
import com.bbthechange.gallery.service.AuthorizationGuard;
import com.bbthechange.gallery.service.EventLifecycleService;
import com.bbthechange.gallery.service.HostAdministrationService;
import com.bbthechange.gallery.util.PaginatedResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Administrator endpoints. Every operation requires an allow-listed admin.
 */
@RestController
@RequestMapping("/admin")
@Tag(name = "Admin", description = "System oversight of hosts, events and uploads")
@SecurityRequirement(name = "Bearer Authentication")
public class AdminController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    private final AdminOverviewService adminOverviewService;
    private final HostAdministrationService hostAdministrationService;
    private final EventLifecycleService eventLifecycleService;
    private final AuthorizationGuard authorizationGuard;

    @Autowired
    public AdminController(AdminOverviewService adminOverviewService,
                           HostAdministrationService hostAdministrationService,
                           EventLifecycleService eventLifecycleService,
                           AuthorizationGuard authorizationGuard) {
        this.adminOverviewService = adminOverviewService;
        this.hostAdministrationService = hostAdministrationService;
        this.eventLifecycleService = eventLifecycleService;
        this.authorizationGuard = authorizationGuard;
    }

    @GetMapping("/overview")
    @Operation(summary = "System totals", description = "Host, event and photo counts with storage usage")
    public ResponseEntity<AdminOverviewResponse> overview(HttpServletRequest request) {
        return ResponseEntity.ok(adminOverviewService.overview(extractActor(request)));
    }

    @GetMapping("/events")
    @Operation(summary = "List all events", description = "Optionally filtered by status")
    public ResponseEntity<PaginatedResult<EventDTO>> listEvents(
            @RequestParam(required = false) EventStatus status,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String nextToken,
            HttpServletRequest request) {
        return ResponseEntity.ok(eventLifecycleService.listAll(extractActor(request), status, pageSize(limit), nextToken));
    }

    @GetMapping("/events/{eventId}")
    @Operation(summary = "Inspect event")
    public ResponseEntity<EventDTO> getEvent(@PathVariable String eventId, HttpServletRequest request) {
        Actor actor = requireAdmin(request);
        return ResponseEntity.ok(eventLifecycleService.get(actor, eventId));
    }

    @PatchMapping("/events/{eventId}/status")
    @Operation(summary = "Suspend or reactivate event", description = "status SUSPENDED suspends an ACTIVE event, ACTIVE reactivates a SUSPENDED one")
    public ResponseEntity<EventDTO> updateEventStatus(@PathVariable String eventId,
                                                      @Valid @RequestBody EventStatusRequest body,
                                                      HttpServletRequest request) {
        Actor actor = requireAdmin(request);
        EventTransition transition;
        if (body.getStatus() == EventStatus.SUSPENDED) {
            transition = EventTransition.SUSPEND;
        } else if (body.getStatus() == EventStatus.ACTIVE) {
            transition = EventTransition.REACTIVATE;
        } else {
            throw new ValidationException("Status must be SUSPENDED or ACTIVE");
        }
        return ResponseEntity.ok(eventLifecycleService.transition(actor, eventId, transition));
    }

    @DeleteMapping("/events/{eventId}")
    @Operation(summary = "Force delete event", description = "Removes the event with all photos and exports")
    public ResponseEntity<Void> forceDeleteEvent(@PathVariable String eventId, HttpServletRequest request) {
        Actor actor = requireAdmin(request);
        eventLifecycleService.forceDelete(actor, eventId);
        logger.info("Admin {} force-deleted event {}", actor.getEmail(), eventId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/events/actions/bulk")
    @Operation(summary = "Bulk admin event action", description = "suspend, reactivate, delete or force-delete per event")
    public ResponseEntity<List<BulkItemResult>> bulkEventAction(@Valid @RequestBody BulkEventActionRequest body,
                                                                HttpServletRequest request) {
        return ResponseEntity.ok(eventLifecycleService.bulk(
            extractActor(request), body.getAction(), body.getEventIds(), true));
    }

    @GetMapping("/uploads/recent")
    @Operation(summary = "Recent uploads", description = "Newest uploads across all events")
    public ResponseEntity<List<RecentUploadDTO>> recentUploads(@RequestParam(required = false) Integer limit,
                                                               HttpServletRequest request) {
        return ResponseEntity.ok(adminOverviewService.recentUploads(extractActor(request), pageSize(limit)));
    }

    @GetMapping("/users")
    @Operation(summary = "List hosts")
    public ResponseEntity<PaginatedResult<HostDTO>> listUsers(@RequestParam(required = false) Integer limit,
                                                              @RequestParam(required = false) String nextToken,
                                                              HttpServletRequest request) {
        return ResponseEntity.ok(hostAdministrationService.listHosts(extractActor(request), pageSize(limit), nextToken));
    }

    @GetMapping("/users/{hostId}")
    @Operation(summary = "Inspect host", description = "Host record with its most recent events")
    public ResponseEntity<HostDetailResponse> getUser(@PathVariable String hostId, HttpServletRequest request) {
        return ResponseEntity.ok(hostAdministrationService.inspect(extractActor(request), hostId));
    }

    @PatchMapping("/users/{hostId}/status")
    @Operation(summary = "Suspend or reactivate host")
    public ResponseEntity<HostDTO> updateUserStatus(@PathVariable String hostId,
                                                    @Valid @RequestBody HostStatusRequest body,
                                                    HttpServletRequest request) {
        return ResponseEntity.ok(hostAdministrationService.updateStatus(extractActor(request), hostId, body.getStatus()));
    }

    private Actor requireAdmin(HttpServletRequest request) {
        Actor actor = extractActor(request);
        authorizationGuard.requireAdmin(actor);
        return actor;
    }
}
