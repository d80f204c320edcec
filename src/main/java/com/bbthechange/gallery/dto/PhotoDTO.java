package com.bbthechange.gallery.dto;

import com.bbthechange.gallery.model.Photo;
import com.bbthechange.gallery.model.PhotoStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class PhotoDTO {
    private String photoId;
    private String eventId;
    private String url;
    private String caption;
    private PhotoStatus approvalStatus;
    private Instant uploadedAt;
    private String moderatedBy;
    private Instant moderatedAt;
    private long fileSize;
    private String contentType;

    public PhotoDTO(Photo photo, String url) {
        this.photoId = photo.getPhotoId();
        this.eventId = photo.getEventId();
        this.url = url;
        this.caption = photo.getCaption();
        this.approvalStatus = photo.getApprovalStatus();
        this.uploadedAt = photo.getUploadedAt();
        this.moderatedBy = photo.getModeratedBy();
        this.moderatedAt = photo.getModeratedAt();
        this.fileSize = photo.getFileSize();
        this.contentType = photo.getContentType();
    }
}
