package com.bbthechange.gallery.service.impl;

import com.bbthechange.gallery.config.ShareProperties;
import com.bbthechange.gallery.config.UploadProperties;
import com.bbthechange.gallery.dto.BulkItemResult;
import com.bbthechange.gallery.dto.BulkOutcome;
import com.bbthechange.gallery.dto.PhotoDTO;
import com.bbthechange.gallery.dto.PublicPhotoDTO;
import com.bbthechange.gallery.dto.UpdatePhotoRequest;
import com.bbthechange.gallery.exception.AccessDeniedException;
import com.bbthechange.gallery.exception.EventNotFoundException;
import com.bbthechange.gallery.exception.IllegalStateTransitionException;
import com.bbthechange.gallery.exception.PhotoNotFoundException;
import com.bbthechange.gallery.exception.QuotaExceededException;
import com.bbthechange.gallery.exception.RepositoryException;
import com.bbthechange.gallery.exception.ShareAccessDeniedException;
import com.bbthechange.gallery.exception.StorageException;
import com.bbthechange.gallery.exception.ValidationException;
import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.model.Photo;
import com.bbthechange.gallery.model.PhotoStatus;
import com.bbthechange.gallery.repository.ConditionalWriteResult;
import com.bbthechange.gallery.repository.HostRepository;
import com.bbthechange.gallery.repository.PhotoRepository;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.security.OperationKind;
import com.bbthechange.gallery.security.ShareDenial;
import com.bbthechange.gallery.service.EventLifecycleService;
import com.bbthechange.gallery.service.NotificationService;
import com.bbthechange.gallery.service.PhotoModerationService;
import com.bbthechange.gallery.service.PhotoStorage;
import com.bbthechange.gallery.service.UploadValidator;
import com.bbthechange.gallery.util.GalleryKeyFactory;
import com.bbthechange.gallery.util.PaginatedResult;
import com.bbthechange.gallery.util.StorageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;

@Service
public class PhotoModerationServiceImpl implements PhotoModerationService {

    private static final Logger logger = LoggerFactory.getLogger(PhotoModerationServiceImpl.class);

    private final PhotoRepository photoRepository;
    private final HostRepository hostRepository;
    private final EventLifecycleService eventLifecycleService;
    private final NotificationService notificationService;
    private final PhotoStorage photoStorage;
    private final UploadValidator uploadValidator;
    private final UploadProperties uploadProperties;
    private final ShareProperties shareProperties;

    @Autowired
    public PhotoModerationServiceImpl(PhotoRepository photoRepository, HostRepository hostRepository,
                                      EventLifecycleService eventLifecycleService,
                                      NotificationService notificationService, PhotoStorage photoStorage,
                                      UploadValidator uploadValidator, UploadProperties uploadProperties,
                                      ShareProperties shareProperties) {
        this.photoRepository = photoRepository;
        this.hostRepository = hostRepository;
        this.eventLifecycleService = eventLifecycleService;
        this.notificationService = notificationService;
        this.photoStorage = photoStorage;
        this.uploadValidator = uploadValidator;
        this.uploadProperties = uploadProperties;
        this.shareProperties = shareProperties;
    }

    @Override
    public PhotoDTO moderate(Actor actor, String eventId, String photoId, PhotoStatus target) {
        if (target != PhotoStatus.APPROVED && target != PhotoStatus.REJECTED) {
            throw new ValidationException("Photos can only be moderated to APPROVED or REJECTED");
        }
        Event event = eventLifecycleService.requireAccessible(actor, eventId, OperationKind.MODERATE_PHOTO);
        Photo photo = requirePhoto(eventId, photoId);
        return toDto(applyModeration(actor, event, photo, target));
    }

    @Override
    public PhotoDTO update(Actor actor, String eventId, String photoId, UpdatePhotoRequest request) {
        if (request.getApprovalStatus() == null && request.getCaption() == null) {
            throw new ValidationException("No valid fields provided for update");
        }
        if (request.getApprovalStatus() == PhotoStatus.PENDING) {
            throw new ValidationException("Photos can only be moderated to APPROVED or REJECTED");
        }
        OperationKind operation = request.getApprovalStatus() != null
            ? OperationKind.MODERATE_PHOTO : OperationKind.EDIT_PHOTO;
        Event event = eventLifecycleService.requireAccessible(actor, eventId, operation);
        Photo photo = requirePhoto(eventId, photoId);
        String caption = request.getCaption() != null ? uploadValidator.normalizeCaption(request.getCaption()) : null;

        // A rejected status change must leave the caption untouched, so moderation is written first.
        if (request.getApprovalStatus() != null) {
            photo = applyModeration(actor, event, photo, request.getApprovalStatus());
        }
        if (request.getCaption() != null) {
            ConditionalWriteResult result = photoRepository.updateCaption(eventId, photoId, caption);
            if (result != ConditionalWriteResult.APPLIED) {
                throw writeRejected(result, eventId, photoId);
            }
            photo.setCaption(caption);
        }
        return toDto(photo);
    }

    private Photo applyModeration(Actor actor, Event event, Photo photo, PhotoStatus target) {
        PhotoStatus observed = photo.getApprovalStatus();
        if (!observed.canTransitionTo(target)) {
            throw new IllegalStateTransitionException("Photo " + photo.getPhotoId() + " is already " + observed);
        }

        Instant now = Instant.now();
        String moderator = actor.moderatorRef();
        ConditionalWriteResult result = photoRepository.transitionApproval(
            event.getEventId(), photo.getPhotoId(), observed, target, moderator, now);
        if (result != ConditionalWriteResult.APPLIED) {
            throw writeRejected(result, event.getEventId(), photo.getPhotoId());
        }

        photo.setApprovalStatus(target);
        photo.setModeratedBy(moderator);
        photo.setModeratedAt(now);
        logger.info("Photo {} of event {} {} -> {} by {}", photo.getPhotoId(), event.getEventId(), observed, target, moderator);
        notificationService.notifyPhotoModerated(event, photo, actor);
        return photo;
    }

    @Override
    public void remove(Actor actor, String eventId, String photoId) {
        Event event = eventLifecycleService.requireAccessible(actor, eventId, OperationKind.REMOVE_PHOTO);
        Photo photo = requirePhoto(eventId, photoId);

        ConditionalWriteResult result = photoRepository.delete(eventId, photoId, photo.getApprovalStatus());
        if (result != ConditionalWriteResult.APPLIED) {
            throw writeRejected(result, eventId, photoId);
        }

        photoStorage.delete(photo.getStorageRef());
        if (photo.getFileSize() > 0) {
            hostRepository.releaseStorage(event.getHostId(), photo.getFileSize());
        }
        logger.info("Photo {} of event {} removed by {}", photoId, eventId, actor);
    }

    @Override
    public List<BulkItemResult> bulkDelete(Actor actor, String eventId, List<String> photoIds) {
        requireIds(photoIds);
        List<BulkItemResult> results = new ArrayList<>();
        for (String photoId : photoIds) {
            results.add(new BulkItemResult(photoId, applyOne(photoId, BulkOutcome.REMOVED,
                id -> remove(actor, eventId, id))));
        }
        logger.info("Bulk delete of {} photos in event {} by {}", photoIds.size(), eventId, actor);
        return results;
    }

    @Override
    public List<BulkItemResult> bulkModerate(Actor actor, String eventId, List<String> photoIds, PhotoStatus target) {
        requireIds(photoIds);
        if (target != PhotoStatus.APPROVED && target != PhotoStatus.REJECTED) {
            throw new ValidationException("Photos can only be moderated to APPROVED or REJECTED");
        }
        List<BulkItemResult> results = new ArrayList<>();
        for (String photoId : photoIds) {
            results.add(new BulkItemResult(photoId, applyOne(photoId, BulkOutcome.APPLIED,
                id -> moderate(actor, eventId, id, target))));
        }
        logger.info("Bulk moderation of {} photos in event {} to {} by {}", photoIds.size(), eventId, target, actor);
        return results;
    }

    private BulkOutcome applyOne(String photoId, BulkOutcome success, Consumer<String> operation) {
        try {
            operation.accept(photoId);
            return success;
        } catch (PhotoNotFoundException | EventNotFoundException e) {
            return BulkOutcome.NOT_FOUND;
        } catch (IllegalStateTransitionException e) {
            return BulkOutcome.ILLEGAL_STATE;
        } catch (AccessDeniedException e) {
            return BulkOutcome.valueOf(e.getReason().name());
        } catch (RepositoryException | StorageException e) {
            logger.error("Bulk operation failed for photo {}", photoId, e);
            return BulkOutcome.FAILED;
        }
    }

    @Override
    public PaginatedResult<PhotoDTO> listForHost(Actor actor, String eventId, PhotoStatus statusFilter,
                                                 int limit, String nextToken) {
        eventLifecycleService.requireAccessible(actor, eventId, OperationKind.LIST_PHOTOS);
        PaginatedResult<Photo> page = photoRepository.findByEvent(eventId, statusFilter, limit, nextToken);
        List<PhotoDTO> photos = page.getResults().stream()
            .map(this::toDto)
            .collect(Collectors.toList());
        return new PaginatedResult<>(photos, page.getNextToken());
    }

    @Override
    public PhotoDTO submitPublicPhoto(Event event, MultipartFile file, String caption) {
        uploadValidator.validateImage(file);
        String normalizedCaption = uploadValidator.normalizeCaption(caption);
        long size = file.getSize();
        String hostId = event.getHostId();

        if (!hostRepository.reserveStorage(hostId, size, uploadProperties.getHostQuota().toBytes())) {
            throw new QuotaExceededException("Storage quota exceeded for this event");
        }

        String photoId = UUID.randomUUID().toString();
        String key = StorageKeys.photoKey(event.getEventId(), photoId, file.getContentType());
        try (InputStream content = file.getInputStream()) {
            photoStorage.put(key, content, size, file.getContentType());
        } catch (IOException e) {
            hostRepository.releaseStorage(hostId, size);
            throw new StorageException("Failed to read uploaded photo", e);
        } catch (StorageException e) {
            hostRepository.releaseStorage(hostId, size);
            throw e;
        }

        Photo photo = new Photo(event.getEventId(), photoId, key, normalizedCaption, size, file.getContentType());
        ConditionalWriteResult result;
        try {
            result = photoRepository.create(photo);
        } catch (RuntimeException e) {
            compensateUpload(hostId, size, key);
            throw e;
        }
        if (result != ConditionalWriteResult.APPLIED) {
            compensateUpload(hostId, size, key);
            logger.info("Upload to event {} rejected, event is no longer active", event.getEventId());
            throw new ShareAccessDeniedException(ShareDenial.NOT_AVAILABLE);
        }
        logger.info("Accepted public upload {} ({} bytes) for event {}", photoId, size, event.getEventId());
        return new PhotoDTO(photo, null);
    }

    private void compensateUpload(String hostId, long size, String key) {
        photoStorage.delete(key);
        hostRepository.releaseStorage(hostId, size);
    }

    @Override
    public PaginatedResult<PublicPhotoDTO> listApproved(Event event, int limit, String nextToken) {
        PaginatedResult<Photo> page = photoRepository.findByEvent(event.getEventId(), PhotoStatus.APPROVED, limit, nextToken);
        List<PublicPhotoDTO> photos = page.getResults().stream()
            .map(photo -> new PublicPhotoDTO(photo, presign(photo)))
            .collect(Collectors.toList());
        return new PaginatedResult<>(photos, page.getNextToken());
    }

    private Photo requirePhoto(String eventId, String photoId) {
        if (!GalleryKeyFactory.isValidId(photoId)) {
            throw new PhotoNotFoundException("Photo not found: " + photoId);
        }
        return photoRepository.findById(eventId, photoId)
            .orElseThrow(() -> new PhotoNotFoundException("Photo not found: " + photoId));
    }

    /**
     * Map a rejected conditional write onto the error the caller sees. A stale write is re-read
     * to tell a concurrent removal apart from a concurrent moderation.
     */
    private RuntimeException writeRejected(ConditionalWriteResult result, String eventId, String photoId) {
        if (result == ConditionalWriteResult.PARENT_UNAVAILABLE) {
            return new IllegalStateTransitionException("Event " + eventId + " is deleted");
        }
        if (photoRepository.findById(eventId, photoId).isEmpty()) {
            return new PhotoNotFoundException("Photo not found: " + photoId);
        }
        return new IllegalStateTransitionException("Photo " + photoId + " was changed concurrently");
    }

    private static void requireIds(List<String> photoIds) {
        if (photoIds == null || photoIds.isEmpty()) {
            throw new ValidationException("At least one photo ID is required");
        }
    }

    private PhotoDTO toDto(Photo photo) {
        return new PhotoDTO(photo, presign(photo));
    }

    private String presign(Photo photo) {
        return photoStorage.presignedGetUrl(photo.getStorageRef(), shareProperties.getPhotoUrlTtl());
    }
}
