package com.bbthechange.gallery.service.impl;

import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.model.ExportJob;
import com.bbthechange.gallery.model.Host;
import com.bbthechange.gallery.model.Photo;
import com.bbthechange.gallery.model.PhotoStatus;
import com.bbthechange.gallery.repository.HostRepository;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.service.GalleryNotification;
import com.bbthechange.gallery.service.NotificationService;
import com.bbthechange.gallery.util.GalleryKeyFactory;
import com.bbthechange.gallery.service.NotificationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Resolves recipients and publishes {@link GalleryNotification}s as application events.
 * A failure here is logged and never propagates to the operation that triggered it.
 */
@Service
public class NotificationServiceImpl implements NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationServiceImpl.class);

    private final ApplicationEventPublisher eventPublisher;
    private final HostRepository hostRepository;

    @Autowired
    public NotificationServiceImpl(ApplicationEventPublisher eventPublisher, HostRepository hostRepository) {
        this.eventPublisher = eventPublisher;
        this.hostRepository = hostRepository;
    }

    @Override
    public void notifyHostWelcomed(Host host) {
        publish(GalleryNotification.hostWelcomed(host.getEmail(), host.getDisplayName()));
    }

    @Override
    public void notifyPhotoModerated(Event event, Photo photo, Actor moderator) {
        if (event.isOwnedBy(moderator.getHostId())) {
            logger.debug("Host {} moderated own photo {}, no notification", moderator.getHostId(), photo.getPhotoId());
            return;
        }
        NotificationType type = photo.getApprovalStatus() == PhotoStatus.APPROVED
            ? NotificationType.PHOTO_APPROVED
            : NotificationType.PHOTO_REJECTED;

        findHost(event.getHostId()).ifPresent(host -> publish(GalleryNotification.photoModerated(
            type, host.getEmail(), host.getDisplayName(), event.getEventId(), event.getTitle())));
    }

    @Override
    public void notifyExportReady(Event event, ExportJob job) {
        findHost(job.getRequestedBy()).ifPresent(host -> publish(GalleryNotification.exportReady(
            host.getEmail(), host.getDisplayName(), event.getEventId(), event.getTitle(),
            job.getPhotoCount(), job.getJobId())));
    }

    private Optional<Host> findHost(String hostId) {
        if (!GalleryKeyFactory.isValidId(hostId)) {
            return Optional.empty();
        }
        try {
            return hostRepository.findById(hostId);
        } catch (RuntimeException e) {
            logger.error("Could not load host {} for notification: {}", hostId, e.getMessage());
            return Optional.empty();
        }
    }

    private void publish(GalleryNotification notification) {
        if (notification.getRecipientEmail() == null) {
            logger.warn("No recipient for {}", notification);
            return;
        }
        try {
            eventPublisher.publishEvent(notification);
            logger.debug("Published {}", notification);
        } catch (RuntimeException e) {
            logger.error("Failed to publish {}: {}", notification, e.getMessage(), e);
        }
    }
}
