package com.bbthechange.gallery.dto;

import com.bbthechange.gallery.model.Event;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * What a visitor sees before entering a password.
 */
@Data
@NoArgsConstructor
public class PublicEventInfo {
    private String title;
    private String description;
    private LocalDate eventDate;
    private String coverImageUrl;
    private boolean hasPassword;
    private long approvedPhotoCount;

    public PublicEventInfo(Event event, String coverImageUrl, long approvedPhotoCount) {
        this.title = event.getTitle();
        this.description = event.getDescription();
        this.eventDate = event.getEventDate();
        this.coverImageUrl = coverImageUrl;
        this.hasPassword = event.hasPassword();
        this.approvedPhotoCount = approvedPhotoCount;
    }
}
