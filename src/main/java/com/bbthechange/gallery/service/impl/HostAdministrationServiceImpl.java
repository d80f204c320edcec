package com.bbthechange.gallery.service.impl;

import com.bbthechange.gallery.dto.EventDTO;
import com.bbthechange.gallery.dto.HostDTO;
import com.bbthechange.gallery.dto.HostDetailResponse;
import com.bbthechange.gallery.exception.HostNotFoundException;
import com.bbthechange.gallery.exception.IllegalStateTransitionException;
import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.model.Host;
import com.bbthechange.gallery.model.HostStatus;
import com.bbthechange.gallery.repository.EventRepository;
import com.bbthechange.gallery.repository.HostRepository;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.service.AuthorizationGuard;
import com.bbthechange.gallery.service.HostAdministrationService;
import com.bbthechange.gallery.util.GalleryKeyFactory;
import com.bbthechange.gallery.util.PaginatedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
public class HostAdministrationServiceImpl implements HostAdministrationService {

    private static final Logger logger = LoggerFactory.getLogger(HostAdministrationServiceImpl.class);
    private static final int RECENT_EVENT_LIMIT = 20;

    private final HostRepository hostRepository;
    private final EventRepository eventRepository;
    private final AuthorizationGuard authorizationGuard;

    @Autowired
    public HostAdministrationServiceImpl(HostRepository hostRepository, EventRepository eventRepository,
                                         AuthorizationGuard authorizationGuard) {
        this.hostRepository = hostRepository;
        this.eventRepository = eventRepository;
        this.authorizationGuard = authorizationGuard;
    }

    @Override
    public PaginatedResult<HostDTO> listHosts(Actor actor, int limit, String nextToken) {
        authorizationGuard.requireAdmin(actor);
        PaginatedResult<Host> page = hostRepository.findAll(limit, nextToken);
        List<HostDTO> hosts = page.getResults().stream()
            .map(HostDTO::new)
            .collect(Collectors.toList());
        return new PaginatedResult<>(hosts, page.getNextToken());
    }

    @Override
    public HostDetailResponse inspect(Actor actor, String hostId) {
        authorizationGuard.requireAdmin(actor);
        Host host = requireHost(hostId);

        PaginatedResult<Event> events = eventRepository.findByHostId(hostId, true, RECENT_EVENT_LIMIT, null);
        List<EventDTO> recent = events.getResults().stream()
            .map(EventDTO::new)
            .collect(Collectors.toList());
        return new HostDetailResponse(new HostDTO(host), recent, events.hasMore());
    }

    @Override
    public HostDTO updateStatus(Actor actor, String hostId, HostStatus target) {
        authorizationGuard.requireAdmin(actor);
        Host host = requireHost(hostId);
        HostStatus observed = host.getStatus();

        if (observed == target) {
            throw new IllegalStateTransitionException("Host " + hostId + " is already " + target);
        }
        if (!hostRepository.updateStatus(hostId, observed, target)) {
            throw new IllegalStateTransitionException("Host " + hostId + " is no longer " + observed);
        }

        host.setStatus(target);
        logger.info("Admin {} changed host {} status {} -> {}", actor.getEmail(), hostId, observed, target);
        return new HostDTO(host);
    }

    private Host requireHost(String hostId) {
        if (!GalleryKeyFactory.isValidId(hostId)) {
            throw new HostNotFoundException("Host not found: " + hostId);
        }
        return hostRepository.findById(hostId)
            .orElseThrow(() -> new HostNotFoundException("Host not found: " + hostId));
    }
}
