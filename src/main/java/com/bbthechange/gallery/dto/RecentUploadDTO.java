package com.bbthechange.gallery.dto;

import com.bbthechange.gallery.model.Photo;
import com.bbthechange.gallery.model.PhotoStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class RecentUploadDTO {
    private String photoId;
    private String eventId;
    private String eventTitle;
    private PhotoStatus approvalStatus;
    private long fileSize;
    private Instant uploadedAt;
    private String url;

    public RecentUploadDTO(Photo photo, String eventTitle, String url) {
        this.photoId = photo.getPhotoId();
        this.eventId = photo.getEventId();
        this.eventTitle = eventTitle;
        this.approvalStatus = photo.getApprovalStatus();
        this.fileSize = photo.getFileSize();
        this.uploadedAt = photo.getUploadedAt();
        this.url = url;
    }
}
