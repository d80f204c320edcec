package com.bbthechange.gallery.model;

import com.bbthechange.gallery.util.GalleryKeyFactory;
import com.bbthechange.gallery.util.InstantAsLongAttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;
import java.util.UUID;

/**
 * A publicly uploaded photo. Shares its partition with the owning event.
 *
 * Key Pattern: PK = EVENT#{eventId}, SK = PHOTO#{photoId}
 */
@DynamoDbBean
public class Photo extends BaseItem {

    private String photoId;
    private String eventId;
    private String storageRef;
    private String caption;
    private PhotoStatus approvalStatus;
    private Instant uploadedAt;
    private String moderatedBy;
    private Instant moderatedAt;
    private long fileSize;
    private String contentType;
    private String uploaderRef;     // random per upload, not an owner

    // Default constructor for DynamoDB
    public Photo() {
        super();
        setItemType(GalleryKeyFactory.PHOTO_ITEM);
    }

    public Photo(String eventId, String photoId, String storageRef, String caption,
                 long fileSize, String contentType) {
        super();
        setItemType(GalleryKeyFactory.PHOTO_ITEM);
        this.photoId = photoId;
        this.eventId = eventId;
        this.storageRef = storageRef;
        this.caption = caption;
        this.fileSize = fileSize;
        this.contentType = contentType;
        this.approvalStatus = PhotoStatus.PENDING;
        this.uploadedAt = getCreatedAt();
        this.uploaderRef = UUID.randomUUID().toString();

        setPk(GalleryKeyFactory.getEventPk(eventId));
        setSk(GalleryKeyFactory.getPhotoSk(photoId));
    }

    public String getPhotoId() {
        return photoId;
    }

    public void setPhotoId(String photoId) {
        this.photoId = photoId;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getStorageRef() {
        return storageRef;
    }

    public void setStorageRef(String storageRef) {
        this.storageRef = storageRef;
    }

    public String getCaption() {
        return caption;
    }

    public void setCaption(String caption) {
        this.caption = caption;
    }

    public PhotoStatus getApprovalStatus() {
        return approvalStatus;
    }

    public void setApprovalStatus(PhotoStatus approvalStatus) {
        this.approvalStatus = approvalStatus;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getUploadedAt() {
        return uploadedAt;
    }

    public void setUploadedAt(Instant uploadedAt) {
        this.uploadedAt = uploadedAt;
    }

    public String getModeratedBy() {
        return moderatedBy;
    }

    public void setModeratedBy(String moderatedBy) {
        this.moderatedBy = moderatedBy;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getModeratedAt() {
        return moderatedAt;
    }

    public void setModeratedAt(Instant moderatedAt) {
        this.moderatedAt = moderatedAt;
    }

    public long getFileSize() {
        return fileSize;
    }

    public void setFileSize(long fileSize) {
        this.fileSize = fileSize;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    public String getUploaderRef() {
        return uploaderRef;
    }

    public void setUploaderRef(String uploaderRef) {
        this.uploaderRef = uploaderRef;
    }
}
