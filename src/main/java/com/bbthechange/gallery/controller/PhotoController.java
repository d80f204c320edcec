package com.bbthechange.gallery.controller;

import com.bbthechange.gallery.dto.BulkItemResult;
import com.bbthechange.gallery.dto.BulkModerateRequest;
import com.bbthechange.gallery.dto.BulkPhotoDeleteRequest;
import com.bbthechange.gallery.dto.ExportJobDTO;
import com.bbthechange.gallery.dto.PhotoDTO;
import com.bbthechange.gallery.dto.UpdatePhotoRequest;
import com.bbthechange.gallery.model.PhotoStatus;
import com.bbthechange.gallery.service.ExportJobService;
import com.bbthechange.gallery.service.PhotoModerationService;
import com.bbthechange.gallery.util.PaginatedResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Moderation and export of an event's photos by its owner or an admin.
 */
@RestController
@RequestMapping("/events/{eventId}")
@Tag(name = "Photos", description = "Moderate, caption, remove and export event photos")
@SecurityRequirement(name = "Bearer Authentication")
public class PhotoController extends BaseController {

    private final PhotoModerationService photoModerationService;
    private final ExportJobService exportJobService;

    @Autowired
    public PhotoController(PhotoModerationService photoModerationService, ExportJobService exportJobService) {
        this.photoModerationService = photoModerationService;
        this.exportJobService = exportJobService;
    }

    @GetMapping("/photos")
    @Operation(summary = "List photos", description = "All photos of the event, optionally filtered by approval status")
    public ResponseEntity<PaginatedResult<PhotoDTO>> listPhotos(
            @PathVariable String eventId,
            @RequestParam(required = false) PhotoStatus status,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String nextToken,
            HttpServletRequest request) {
        return ResponseEntity.ok(photoModerationService.listForHost(
            extractActor(request), eventId, status, pageSize(limit), nextToken));
    }

    @PatchMapping("/photos/{photoId}")
    @Operation(summary = "Update photo", description = "Approve, reject, or change the caption")
    public ResponseEntity<PhotoDTO> updatePhoto(@PathVariable String eventId,
                                                @PathVariable String photoId,
                                                @Valid @RequestBody UpdatePhotoRequest body,
                                                HttpServletRequest request) {
        return ResponseEntity.ok(photoModerationService.update(extractActor(request), eventId, photoId, body));
    }

    @DeleteMapping("/photos/{photoId}")
    @Operation(summary = "Remove photo", description = "Permanently deletes the photo and its stored file")
    public ResponseEntity<Void> removePhoto(@PathVariable String eventId,
                                            @PathVariable String photoId,
                                            HttpServletRequest request) {
        photoModerationService.remove(extractActor(request), eventId, photoId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/photos/bulk-delete")
    @Operation(summary = "Bulk remove photos", description = "Each photo is removed independently; the result lists one outcome per id")
    public ResponseEntity<List<BulkItemResult>> bulkDelete(@PathVariable String eventId,
                                                           @Valid @RequestBody BulkPhotoDeleteRequest body,
                                                           HttpServletRequest request) {
        return ResponseEntity.ok(photoModerationService.bulkDelete(extractActor(request), eventId, body.getPhotoIds()));
    }

    @PostMapping("/photos/bulk-moderate")
    @Operation(summary = "Bulk moderate photos", description = "Approve or reject many photos with per-id outcomes")
    public ResponseEntity<List<BulkItemResult>> bulkModerate(@PathVariable String eventId,
                                                             @Valid @RequestBody BulkModerateRequest body,
                                                             HttpServletRequest request) {
        return ResponseEntity.ok(photoModerationService.bulkModerate(
            extractActor(request), eventId, body.getPhotoIds(), body.getApprovalStatus()));
    }

    @PostMapping("/exports")
    @Operation(summary = "Start export", description = "Queues a ZIP archive of the approved photos")
    public ResponseEntity<ExportJobDTO> startExport(@PathVariable String eventId, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(exportJobService.submit(extractActor(request), eventId));
    }

    @GetMapping("/exports/{jobId}")
    @Operation(summary = "Get export", description = "Job status; completed jobs include a download URL")
    public ResponseEntity<ExportJobDTO> getExport(@PathVariable String eventId,
                                                  @PathVariable String jobId,
                                                  HttpServletRequest request) {
        return ResponseEntity.ok(exportJobService.get(extractActor(request), eventId, jobId));
    }
}
