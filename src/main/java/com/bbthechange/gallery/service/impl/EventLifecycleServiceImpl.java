package com.bbthechange.gallery.service.impl;

import com.bbthechange.gallery.config.ShareProperties;
import com.bbthechange.gallery.dto.BulkItemResult;
import com.bbthechange.gallery.dto.BulkOutcome;
import com.bbthechange.gallery.dto.CreateEventRequest;
import com.bbthechange.gallery.dto.EventDTO;
import com.bbthechange.gallery.dto.UpdateEventRequest;
import com.bbthechange.gallery.exception.AccessDeniedException;
import com.bbthechange.gallery.exception.EventNotFoundException;
import com.bbthechange.gallery.exception.IllegalStateTransitionException;
import com.bbthechange.gallery.exception.RepositoryException;
import com.bbthechange.gallery.exception.StorageException;
import com.bbthechange.gallery.exception.ValidationException;
import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.model.EventStatus;
import com.bbthechange.gallery.model.EventTransition;
import com.bbthechange.gallery.model.Photo;
import com.bbthechange.gallery.repository.EventRepository;
import com.bbthechange.gallery.repository.HostRepository;
import com.bbthechange.gallery.repository.PhotoRepository;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.security.OperationKind;
import com.bbthechange.gallery.service.AuthorizationGuard;
import com.bbthechange.gallery.service.EventLifecycleService;
import com.bbthechange.gallery.service.PasswordService;
import com.bbthechange.gallery.service.PhotoStorage;
import com.bbthechange.gallery.service.UploadValidator;
import com.bbthechange.gallery.util.GalleryKeyFactory;
import com.bbthechange.gallery.util.PaginatedResult;
import com.bbthechange.gallery.util.ShareTokenGenerator;
import com.bbthechange.gallery.util.StorageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class EventLifecycleServiceImpl implements EventLifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(EventLifecycleServiceImpl.class);

    private final EventRepository eventRepository;
    private final PhotoRepository photoRepository;
    private final HostRepository hostRepository;
    private final AuthorizationGuard authorizationGuard;
    private final PasswordService passwordService;
    private final PhotoStorage photoStorage;
    private final UploadValidator uploadValidator;
    private final ShareProperties shareProperties;

    @Autowired
    public EventLifecycleServiceImpl(EventRepository eventRepository, PhotoRepository photoRepository,
                                     HostRepository hostRepository, AuthorizationGuard authorizationGuard,
                                     PasswordService passwordService, PhotoStorage photoStorage,
                                     UploadValidator uploadValidator, ShareProperties shareProperties) {
        this.eventRepository = eventRepository;
        this.photoRepository = photoRepository;
        this.hostRepository = hostRepository;
        this.authorizationGuard = authorizationGuard;
        this.passwordService = passwordService;
        this.photoStorage = photoStorage;
        this.uploadValidator = uploadValidator;
        this.shareProperties = shareProperties;
    }

    @Override
    public EventDTO create(Actor actor, CreateEventRequest request) {
        if (actor.getHost() == null) {
            throw new ValidationException("Only hosts can create events");
        }
        authorizationGuard.requireActiveHost(actor);

        String title = trimToNull(request.getTitle());
        if (title == null) {
            throw new ValidationException("Event title is required");
        }

        String shareToken = ShareTokenGenerator.generateUnique(eventRepository::shareTokenExists);
        Event event = new Event(actor.getHostId(), title, trimToNull(request.getDescription()),
            request.getEventDate(), shareToken);
        if (request.getPassword() != null && !request.getPassword().isEmpty()) {
            event.setAccessPasswordHash(passwordService.hash(request.getPassword()));
        }

        eventRepository.create(event);
        logger.info("Host {} created event {}", actor.getHostId(), event.getEventId());
        return toDto(event);
    }

    @Override
    public PaginatedResult<EventDTO> listOwn(Actor actor, int limit, String nextToken) {
        if (actor.getHost() == null) {
            return new PaginatedResult<>(List.of(), null);
        }
        PaginatedResult<Event> page = eventRepository.findByHostId(actor.getHostId(), false, limit, nextToken);
        return mapPage(page);
    }

    @Override
    public EventDTO get(Actor actor, String eventId) {
        return toDto(requireAccessible(actor, eventId, OperationKind.VIEW_EVENT));
    }

    @Override
    public EventDTO updateMetadata(Actor actor, String eventId, UpdateEventRequest request) {
        if (!request.hasChanges()) {
            throw new ValidationException("No valid fields provided for update");
        }
        Event event = requireAccessible(actor, eventId, OperationKind.UPDATE_EVENT);
        EventStatus observed = event.getStatus();
        Map<String, AttributeValue> updates = new HashMap<>();

        if (request.getTitle() != null) {
            String title = trimToNull(request.getTitle());
            if (title == null) {
                throw new ValidationException("Event title cannot be blank");
            }
            event.setTitle(title);
            updates.put("title", stringOrRemove(title));
        }
        if (request.getDescription() != null) {
            event.setDescription(trimToNull(request.getDescription()));
            updates.put("description", stringOrRemove(event.getDescription()));
        }
        if (request.getEventDate() != null) {
            event.setEventDate(request.getEventDate());
            updates.put("eventDate", stringOrRemove(request.getEventDate().toString()));
        }
        if (Boolean.TRUE.equals(request.getRemovePassword())) {
            event.setAccessPasswordHash(null);
            updates.put("accessPasswordHash", stringOrRemove(null));
        } else if (request.getPassword() != null && !request.getPassword().isEmpty()) {
            event.setAccessPasswordHash(passwordService.hash(request.getPassword()));
            updates.put("accessPasswordHash", stringOrRemove(event.getAccessPasswordHash()));
        }
        if (updates.isEmpty()) {
            throw new ValidationException("No valid fields provided for update");
        }

        if (!eventRepository.updateMetadata(eventId, observed, updates)) {
            throw staleStatus(eventId, observed);
        }
        logger.info("Updated metadata of event {} by {}", eventId, actor);
        return toDto(event);
    }

    @Override
    public EventDTO setCover(Actor actor, String eventId, MultipartFile file) {
        Event event = requireAccessible(actor, eventId, OperationKind.UPDATE_EVENT);
        uploadValidator.validateImage(file);
        EventStatus observed = event.getStatus();

        String previous = event.getCoverImageRef();
        String key = StorageKeys.coverKey(eventId, file.getContentType());
        try (InputStream content = file.getInputStream()) {
            photoStorage.put(key, content, file.getSize(), file.getContentType());
        } catch (IOException e) {
            throw new StorageException("Failed to read uploaded cover image", e);
        }

        event.setCoverImageRef(key);
        if (!eventRepository.updateMetadata(eventId, observed, Map.of("coverImageRef", stringOrRemove(key)))) {
            photoStorage.delete(key);
            throw staleStatus(eventId, observed);
        }
        if (previous != null) {
            photoStorage.delete(previous);
        }
        logger.info("Replaced cover image of event {}", eventId);
        return toDto(event);
    }

    @Override
    public EventDTO transition(Actor actor, String eventId, EventTransition transition) {
        if (transition == EventTransition.FORCE_DELETE) {
            throw new ValidationException("Force delete removes the event and has no resulting status");
        }
        Event event = requireAccessible(actor, eventId, operationFor(transition));
        EventStatus observed = event.getStatus();

        if (!transition.isAllowedFrom(observed)) {
            throw new IllegalStateTransitionException(
                "Cannot " + transition.name().toLowerCase(Locale.ROOT) + " an event that is " + observed);
        }
        if (!eventRepository.transitionStatus(eventId, observed, transition.getTarget())) {
            throw staleStatus(eventId, observed);
        }

        event.setStatus(transition.getTarget());
        logger.info("Event {} {} -> {} by {}", eventId, observed, transition.getTarget(), actor);
        return toDto(event);
    }

    @Override
    public void forceDelete(Actor actor, String eventId) {
        Event event;
        if (actor.isAdmin()) {
            event = findExisting(eventId);
            authorizationGuard.check(actor, OperationKind.FORCE_DELETE_EVENT, event).orThrow();
        } else {
            event = requireAccessible(actor, eventId, OperationKind.FORCE_DELETE_EVENT);
        }
        EventStatus observed = event.getStatus();

        long storedBytes = photoRepository.findAllByEvent(eventId, null).stream()
            .mapToLong(Photo::getFileSize)
            .sum();

        List<String> storageRefs = eventRepository.forceDelete(eventId, observed)
            .orElseThrow(() -> staleStatus(eventId, observed));

        storageRefs.forEach(photoStorage::delete);
        if (event.getCoverImageRef() != null) {
            photoStorage.delete(event.getCoverImageRef());
        }
        if (storedBytes > 0) {
            hostRepository.releaseStorage(event.getHostId(), storedBytes);
        }
        logger.info("Force-deleted event {} ({} stored objects) by {}", eventId, storageRefs.size(), actor);
    }

    @Override
    public List<BulkItemResult> bulk(Actor actor, String action, List<String> eventIds, boolean adminSurface) {
        if (adminSurface) {
            authorizationGuard.requireAdmin(actor);
        }
        if (eventIds == null || eventIds.isEmpty()) {
            throw new ValidationException("At least one event ID is required");
        }
        String normalized = action == null ? "" : action.trim().toLowerCase(Locale.ROOT);
        List<String> accepted = adminSurface ? ADMIN_BULK_ACTIONS : HOST_BULK_ACTIONS;
        if (!accepted.contains(normalized)) {
            throw new ValidationException("Invalid action '" + action + "'. Must be one of: " + String.join(", ", accepted));
        }
        EventTransition transition = EventTransition.valueOf(normalized.replace('-', '_').toUpperCase(Locale.ROOT));

        List<BulkItemResult> results = new ArrayList<>();
        for (String eventId : eventIds) {
            results.add(new BulkItemResult(eventId, applyOne(actor, eventId, transition)));
        }
        logger.info("Bulk {} on {} events by {}", normalized, eventIds.size(), actor);
        return results;
    }

    private BulkOutcome applyOne(Actor actor, String eventId, EventTransition transition) {
        try {
            if (transition == EventTransition.FORCE_DELETE) {
                forceDelete(actor, eventId);
                return BulkOutcome.REMOVED;
            }
            transition(actor, eventId, transition);
            return BulkOutcome.APPLIED;
        } catch (EventNotFoundException e) {
            return BulkOutcome.NOT_FOUND;
        } catch (IllegalStateTransitionException e) {
            return BulkOutcome.ILLEGAL_STATE;
        } catch (AccessDeniedException e) {
            return BulkOutcome.valueOf(e.getReason().name());
        } catch (RepositoryException | StorageException e) {
            logger.error("Bulk {} failed for event {}", transition, eventId, e);
            return BulkOutcome.FAILED;
        }
    }

    @Override
    public PaginatedResult<EventDTO> listAll(Actor actor, EventStatus statusFilter, int limit, String nextToken) {
        authorizationGuard.requireAdmin(actor);
        return mapPage(eventRepository.findAll(statusFilter, limit, nextToken));
    }

    @Override
    public Event requireAccessible(Actor actor, String eventId, OperationKind operation) {
        Event event = findExisting(eventId);

        if (event.getStatus() == EventStatus.DELETED) {
            if (actor.isAdmin() || event.isOwnedBy(actor.getHostId())) {
                throw new IllegalStateTransitionException("Event " + eventId + " is deleted");
            }
            throw new EventNotFoundException("Event not found: " + eventId);
        }

        authorizationGuard.check(actor, operation, event).orThrow();
        return event;
    }

    private Event findExisting(String eventId) {
        if (!GalleryKeyFactory.isValidId(eventId)) {
            throw new EventNotFoundException("Event not found: " + eventId);
        }
        return eventRepository.findById(eventId)
            .orElseThrow(() -> new EventNotFoundException("Event not found: " + eventId));
    }

    private static AttributeValue stringOrRemove(String value) {
        return value == null
            ? AttributeValue.builder().nul(true).build()
            : AttributeValue.builder().s(value).build();
    }

    private static OperationKind operationFor(EventTransition transition) {
        switch (transition) {
            case PUBLISH:
                return OperationKind.PUBLISH_EVENT;
            case SUSPEND:
                return OperationKind.SUSPEND_EVENT;
            case REACTIVATE:
                return OperationKind.REACTIVATE_EVENT;
            case DELETE:
                return OperationKind.DELETE_EVENT;
            default:
                return OperationKind.FORCE_DELETE_EVENT;
        }
    }

    private PaginatedResult<EventDTO> mapPage(PaginatedResult<Event> page) {
        List<EventDTO> dtos = page.getResults().stream()
            .map(this::toDto)
            .collect(Collectors.toList());
        return new PaginatedResult<>(dtos, page.getNextToken());
    }

    private EventDTO toDto(Event event) {
        EventDTO dto = new EventDTO(event);
        if (event.getCoverImageRef() != null) {
            dto.setCoverImageUrl(photoStorage.presignedGetUrl(event.getCoverImageRef(), shareProperties.getPhotoUrlTtl()));
        }
        return dto;
    }

    private static IllegalStateTransitionException staleStatus(String eventId, EventStatus observed) {
        return new IllegalStateTransitionException("Event " + eventId + " is no longer " + observed);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
