package com.bbthechange.gallery.service;

import com.bbthechange.gallery.dto.ProfileResponse;
import com.bbthechange.gallery.dto.UpdateProfileRequest;
import com.bbthechange.gallery.security.Actor;

public interface ProfileService {

    ProfileResponse getProfile(Actor actor);

    ProfileResponse updateProfile(Actor actor, UpdateProfileRequest request);
}
