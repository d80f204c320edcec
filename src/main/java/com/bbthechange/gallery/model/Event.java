package com.bbthechange.gallery.model;

import com.bbthechange.gallery.util.GalleryKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Photo-sharing event owned by a single host.
 *
 * Key Pattern: PK = EVENT#{eventId}, SK = METADATA
 * HostIndex: GSI1PK = HOST#{hostId}, GSI1SK = CREATED#{timestamp}
 * ShareTokenIndex: GSI2PK = SHARE#{shareToken}
 */
@DynamoDbBean
public class Event extends BaseItem {

    private String eventId;
    private String hostId;
    private String title;
    private String description;
    private LocalDate eventDate;
    private EventStatus status;
    private String accessPasswordHash;
    private String shareToken;
    private String coverImageRef;

    // Default constructor for DynamoDB
    public Event() {
        super();
        setItemType(GalleryKeyFactory.EVENT_ITEM);
    }

    /**
     * Create a new DRAFT event with generated UUID. The share token is fixed for the event's lifetime.
     */
    public Event(String hostId, String title, String description, LocalDate eventDate, String shareToken) {
        super();
        setItemType(GalleryKeyFactory.EVENT_ITEM);
        this.eventId = UUID.randomUUID().toString();
        this.hostId = hostId;
        this.title = title;
        this.description = description;
        this.eventDate = eventDate;
        this.shareToken = shareToken;
        this.status = EventStatus.DRAFT;

        setPk(GalleryKeyFactory.getEventPk(this.eventId));
        setSk(GalleryKeyFactory.getMetadataSk());
        setGsi1pk(GalleryKeyFactory.getHostEventsGsi1pk(hostId));
        setGsi1sk(GalleryKeyFactory.getCreatedSk(getCreatedAt()));
        setGsi2pk(GalleryKeyFactory.getShareTokenGsi2pk(shareToken));
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getHostId() {
        return hostId;
    }

    public void setHostId(String hostId) {
        this.hostId = hostId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public LocalDate getEventDate() {
        return eventDate;
    }

    public void setEventDate(LocalDate eventDate) {
        this.eventDate = eventDate;
    }

    public EventStatus getStatus() {
        return status;
    }

    public void setStatus(EventStatus status) {
        this.status = status;
    }

    public String getAccessPasswordHash() {
        return accessPasswordHash;
    }

    public void setAccessPasswordHash(String accessPasswordHash) {
        this.accessPasswordHash = accessPasswordHash;
    }

    public String getShareToken() {
        return shareToken;
    }

    public void setShareToken(String shareToken) {
        this.shareToken = shareToken;
    }

    public String getCoverImageRef() {
        return coverImageRef;
    }

    public void setCoverImageRef(String coverImageRef) {
        this.coverImageRef = coverImageRef;
    }

    public boolean hasPassword() {
        return accessPasswordHash != null && !accessPasswordHash.isEmpty();
    }

    public boolean isOwnedBy(String candidateHostId) {
        return hostId != null && hostId.equals(candidateHostId);
    }
}
