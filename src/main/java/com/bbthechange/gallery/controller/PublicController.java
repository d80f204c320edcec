package com.bbthechange.gallery.controller;

import com.bbthechange.gallery.dto.PasswordCheckRequest;
import com.bbthechange.gallery.dto.PhotoDTO;
import com.bbthechange.gallery.dto.PublicEventInfo;
import com.bbthechange.gallery.dto.PublicPhotoDTO;
import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.service.PhotoModerationService;
import com.bbthechange.gallery.service.ShareAccessGate;
import com.bbthechange.gallery.util.PaginatedResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.Map;

/**
 * Anonymous visitor endpoints addressed by share token.
 */
@RestController
@RequestMapping("/public/events/{shareToken}")
@Tag(name = "Public", description = "Visitor access to shared events")
public class PublicController extends BaseController {

    static final String PASSWORD_HEADER = "X-Event-Password";

    private final ShareAccessGate shareAccessGate;
    private final PhotoModerationService photoModerationService;

    @Autowired
    public PublicController(ShareAccessGate shareAccessGate, PhotoModerationService photoModerationService) {
        this.shareAccessGate = shareAccessGate;
        this.photoModerationService = photoModerationService;
    }

    @GetMapping
    @Operation(summary = "Public event info", description = "Title, date, cover and whether a password is required")
    public ResponseEntity<PublicEventInfo> getEventInfo(@PathVariable String shareToken) {
        return ResponseEntity.ok(shareAccessGate.publicInfo(shareToken));
    }

    @PostMapping("/verify-password")
    @Operation(summary = "Check event password")
    public ResponseEntity<Map<String, Object>> verifyPassword(
            @PathVariable String shareToken,
            @RequestHeader(value = PASSWORD_HEADER, required = false) String headerPassword,
            @RequestBody(required = false) PasswordCheckRequest body) {
        String password = headerPassword != null ? headerPassword : body != null ? body.getPassword() : null;
        shareAccessGate.evaluate(shareToken, password).orThrow();
        return ResponseEntity.ok(Map.of("granted", true));
    }

    @GetMapping("/photos")
    @Operation(summary = "Approved photos", description = "Only approved photos are ever shown to visitors")
    public ResponseEntity<PaginatedResult<PublicPhotoDTO>> listPhotos(
            @PathVariable String shareToken,
            @RequestHeader(value = PASSWORD_HEADER, required = false) String password,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String nextToken) {
        Event event = shareAccessGate.evaluate(shareToken, password).orThrow();
        return ResponseEntity.ok(photoModerationService.listApproved(event, pageSize(limit), nextToken));
    }

    @PostMapping(value = "/photos", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload photo", description = "Stores the photo as PENDING until the host approves it")
    public ResponseEntity<PhotoDTO> uploadPhoto(
            @PathVariable String shareToken,
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "caption", required = false) String caption,
            @RequestParam(value = "password", required = false) String formPassword,
            @RequestHeader(value = PASSWORD_HEADER, required = false) String headerPassword) {
        String password = headerPassword != null ? headerPassword : formPassword;
        Event event = shareAccessGate.requireUploadAccess(shareToken, password);
        PhotoDTO photo = photoModerationService.submitPublicPhoto(event, file, caption);
        return ResponseEntity.status(HttpStatus.CREATED).body(photo);
    }
}
