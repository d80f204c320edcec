package com.bbthechange.gallery.dto;

import com.bbthechange.gallery.model.EventStatus;
import com.bbthechange.gallery.model.PhotoStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AdminOverviewResponse {
    private long totalHosts;
    private long totalEvents;
    private Map<EventStatus, Long> eventsByStatus;
    private long totalPhotos;
    private Map<PhotoStatus, Long> photosByStatus;
    private long totalStorageBytes;
}
