package com.bbthechange.gallery.dto;

import com.bbthechange.gallery.model.PhotoStatus;

import java.util.EnumMap;
import java.util.Map;

/**
 * Photo totals across the whole gallery.
 */
public class PhotoStats {

    private final Map<PhotoStatus, Long> countByStatus;
    private final long totalBytes;

    public PhotoStats(Map<PhotoStatus, Long> countByStatus, long totalBytes) {
        this.countByStatus = new EnumMap<>(PhotoStatus.class);
        for (PhotoStatus status : PhotoStatus.values()) {
            this.countByStatus.put(status, countByStatus.getOrDefault(status, 0L));
        }
        this.totalBytes = totalBytes;
    }

    public Map<PhotoStatus, Long> getCountByStatus() {
        return countByStatus;
    }

    public long getTotalCount() {
        return countByStatus.values().stream().mapToLong(Long::longValue).sum();
    }

    public long getTotalBytes() {
        return totalBytes;
    }
}
