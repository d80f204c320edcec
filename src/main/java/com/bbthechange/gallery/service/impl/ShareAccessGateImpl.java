package com.bbthechange.gallery.service.impl;

import com.bbthechange.gallery.config.ShareProperties;
import com.bbthechange.gallery.dto.PublicEventInfo;
import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.model.EventStatus;
import com.bbthechange.gallery.model.PhotoStatus;
import com.bbthechange.gallery.repository.EventRepository;
import com.bbthechange.gallery.repository.PhotoRepository;
import com.bbthechange.gallery.security.ShareAccessDecision;
import com.bbthechange.gallery.security.ShareDenial;
import com.bbthechange.gallery.service.PasswordService;
import com.bbthechange.gallery.service.PhotoStorage;
import com.bbthechange.gallery.service.ShareAccessGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class ShareAccessGateImpl implements ShareAccessGate {

    private static final Logger logger = LoggerFactory.getLogger(ShareAccessGateImpl.class);

    private final EventRepository eventRepository;
    private final PhotoRepository photoRepository;
    private final PasswordService passwordService;
    private final PhotoStorage photoStorage;
    private final ShareProperties shareProperties;

    @Autowired
    public ShareAccessGateImpl(EventRepository eventRepository, PhotoRepository photoRepository,
                               PasswordService passwordService, PhotoStorage photoStorage,
                               ShareProperties shareProperties) {
        this.eventRepository = eventRepository;
        this.photoRepository = photoRepository;
        this.passwordService = passwordService;
        this.photoStorage = photoStorage;
        this.shareProperties = shareProperties;
    }

    @Override
    public ShareAccessDecision evaluate(String shareToken, String password) {
        Optional<Event> available = findAvailable(shareToken);
        if (available.isEmpty()) {
            return ShareAccessDecision.denied(ShareDenial.NOT_AVAILABLE);
        }
        Event event = available.get();
        if (event.hasPassword() && !passwordService.matches(password, event.getAccessPasswordHash())) {
            logger.debug("Wrong password for shared event {}", event.getEventId());
            return ShareAccessDecision.denied(ShareDenial.WRONG_PASSWORD);
        }
        return ShareAccessDecision.granted(event);
    }

    @Override
    public Event requireUploadAccess(String shareToken, String password) {
        if (shareProperties.isPasswordGatesUploads()) {
            return evaluate(shareToken, password).orThrow();
        }
        return findAvailable(shareToken)
            .map(ShareAccessDecision::granted)
            .orElseGet(() -> ShareAccessDecision.denied(ShareDenial.NOT_AVAILABLE))
            .orThrow();
    }

    @Override
    public PublicEventInfo publicInfo(String shareToken) {
        Event event = findAvailable(shareToken)
            .map(ShareAccessDecision::granted)
            .orElseGet(() -> ShareAccessDecision.denied(ShareDenial.NOT_AVAILABLE))
            .orThrow();

        String coverUrl = event.getCoverImageRef() == null
            ? null
            : photoStorage.presignedGetUrl(event.getCoverImageRef(), shareProperties.getPhotoUrlTtl());
        long approved = photoRepository.countByEvent(event.getEventId(), PhotoStatus.APPROVED);
        return new PublicEventInfo(event, coverUrl, approved);
    }

    private Optional<Event> findAvailable(String shareToken) {
        return eventRepository.findByShareToken(shareToken)
            .filter(event -> event.getStatus() == EventStatus.ACTIVE);
    }
}
