package com.bbthechange.gallery.service.impl;

import com.bbthechange.gallery.config.ShareProperties;
import com.bbthechange.gallery.dto.AdminOverviewResponse;
import com.bbthechange.gallery.dto.PhotoStats;
import com.bbthechange.gallery.dto.RecentUploadDTO;
import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.model.EventStatus;
import com.bbthechange.gallery.model.Photo;
import com.bbthechange.gallery.repository.EventRepository;
import com.bbthechange.gallery.repository.HostRepository;
import com.bbthechange.gallery.repository.PhotoRepository;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.service.AdminOverviewService;
import com.bbthechange.gallery.service.AuthorizationGuard;
import com.bbthechange.gallery.service.PhotoStorage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class AdminOverviewServiceImpl implements AdminOverviewService {

    private final HostRepository hostRepository;
    private final EventRepository eventRepository;
    private final PhotoRepository photoRepository;
    private final PhotoStorage photoStorage;
    private final AuthorizationGuard authorizationGuard;
    private final ShareProperties shareProperties;

    @Autowired
    public AdminOverviewServiceImpl(HostRepository hostRepository, EventRepository eventRepository,
                                    PhotoRepository photoRepository, PhotoStorage photoStorage,
                                    AuthorizationGuard authorizationGuard, ShareProperties shareProperties) {
        this.hostRepository = hostRepository;
        this.eventRepository = eventRepository;
        this.photoRepository = photoRepository;
        this.photoStorage = photoStorage;
        this.authorizationGuard = authorizationGuard;
        this.shareProperties = shareProperties;
    }

    @Override
    public AdminOverviewResponse overview(Actor actor) {
        authorizationGuard.requireAdmin(actor);

        Map<EventStatus, Long> eventsByStatus = eventRepository.countByStatus();
        long totalEvents = eventsByStatus.values().stream().mapToLong(Long::longValue).sum();
        PhotoStats photoStats = photoRepository.summarize();

        return new AdminOverviewResponse(
            hostRepository.countAll(),
            totalEvents,
            eventsByStatus,
            photoStats.getTotalCount(),
            photoStats.getCountByStatus(),
            photoStats.getTotalBytes());
    }

    @Override
    public List<RecentUploadDTO> recentUploads(Actor actor, int limit) {
        authorizationGuard.requireAdmin(actor);

        Map<String, String> titles = new HashMap<>();
        List<RecentUploadDTO> uploads = new ArrayList<>();
        for (Photo photo : photoRepository.findRecent(limit)) {
            String title = titles.computeIfAbsent(photo.getEventId(), eventId ->
                eventRepository.findById(eventId).map(Event::getTitle).orElse(null));
            String url = photoStorage.presignedGetUrl(photo.getStorageRef(), shareProperties.getPhotoUrlTtl());
            uploads.add(new RecentUploadDTO(photo, title, url));
        }
        return uploads;
    }
}
