package com.bbthechange.gallery.dto;

import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.model.EventStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@NoArgsConstructor
public class EventDTO {
    private String eventId;
    private String hostId;
    private String title;
    private String description;
    private LocalDate eventDate;
    private EventStatus status;
    private String shareToken;
    private boolean hasPassword;
    private String coverImageRef;
    private String coverImageUrl;
    private Instant createdAt;
    private Instant updatedAt;

    public EventDTO(Event event) {
        this.eventId = event.getEventId();
        this.hostId = event.getHostId();
        this.title = event.getTitle();
        this.description = event.getDescription();
        this.eventDate = event.getEventDate();
        this.status = event.getStatus();
        this.shareToken = event.getShareToken();
        this.hasPassword = event.hasPassword();
        this.coverImageRef = event.getCoverImageRef();
        this.createdAt = event.getCreatedAt();
        this.updatedAt = event.getUpdatedAt();
    }
}
