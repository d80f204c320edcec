package com.bbthechange.gallery.service.impl;

import com.bbthechange.gallery.dto.ProfileResponse;
import com.bbthechange.gallery.dto.UpdateProfileRequest;
import com.bbthechange.gallery.exception.HostNotFoundException;
import com.bbthechange.gallery.exception.ValidationException;
import com.bbthechange.gallery.model.Host;
import com.bbthechange.gallery.repository.HostRepository;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.service.AuthorizationGuard;
import com.bbthechange.gallery.service.ProfileService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class ProfileServiceImpl implements ProfileService {

    private static final Logger logger = LoggerFactory.getLogger(ProfileServiceImpl.class);

    private final HostRepository hostRepository;
    private final AuthorizationGuard authorizationGuard;

    @Autowired
    public ProfileServiceImpl(HostRepository hostRepository, AuthorizationGuard authorizationGuard) {
        this.hostRepository = hostRepository;
        this.authorizationGuard = authorizationGuard;
    }

    @Override
    public ProfileResponse getProfile(Actor actor) {
        requireHost(actor);
        return new ProfileResponse(actor);
    }

    @Override
    public ProfileResponse updateProfile(Actor actor, UpdateProfileRequest request) {
        Host host = requireHost(actor);
        authorizationGuard.requireActiveHost(actor);

        String displayName = request.getDisplayName();
        if (displayName == null || displayName.isEmpty()) {
            throw new ValidationException("Display name is required");
        }
        host.setDisplayName(displayName);
        hostRepository.updateProfile(host);

        logger.info("Host {} updated profile", host.getHostId());
        return new ProfileResponse(actor);
    }

    private static Host requireHost(Actor actor) {
        if (actor.getHost() == null) {
            throw new HostNotFoundException("No host profile for this account");
        }
        return actor.getHost();
    }
}
