package com.bbthechange.gallery.dto;

import com.bbthechange.gallery.model.Photo;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Visitor-facing view of an approved photo. Moderation details stay private.
 */
@Data
@NoArgsConstructor
public class PublicPhotoDTO {
    private String photoId;
    private String url;
    private String caption;
    private Instant uploadedAt;

    public PublicPhotoDTO(Photo photo, String url) {
        this.photoId = photo.getPhotoId();
        this.url = url;
        this.caption = photo.getCaption();
        this.uploadedAt = photo.getUploadedAt();
    }
}
