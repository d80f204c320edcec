package com.bbthechange.gallery.controller;

import com.bbthechange.gallery.dto.ProfileResponse;
import com.bbthechange.gallery.dto.UpdateProfileRequest;
import com.bbthechange.gallery.service.ProfileService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/me")
@Tag(name = "Profile", description = "Host profile management")
@SecurityRequirement(name = "Bearer Authentication")
public class ProfileController extends BaseController {

    private final ProfileService profileService;

    @Autowired
    public ProfileController(ProfileService profileService) {
        this.profileService = profileService;
    }

    @GetMapping
    @Operation(summary = "Get profile", description = "Returns the current host's profile and admin flag")
    public ResponseEntity<ProfileResponse> getProfile(HttpServletRequest request) {
        return ResponseEntity.ok(profileService.getProfile(extractActor(request)));
    }

    @PatchMapping
    @Operation(summary = "Update profile", description = "Changes the display name")
    public ResponseEntity<ProfileResponse> updateProfile(@Valid @RequestBody UpdateProfileRequest body,
                                                         HttpServletRequest request) {
        return ResponseEntity.ok(profileService.updateProfile(extractActor(request), body));
    }
}
