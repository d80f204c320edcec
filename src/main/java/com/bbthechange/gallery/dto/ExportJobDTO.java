package com.bbthechange.gallery.dto;

import com.bbthechange.gallery.model.ExportJob;
import com.bbthechange.gallery.model.ExportJobStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class ExportJobDTO {
    private String jobId;
    private String eventId;
    private ExportJobStatus status;
    private int photoCount;
    private String downloadUrl;     // present once COMPLETED
    private String failureReason;
    private Instant createdAt;
    private Instant updatedAt;

    public ExportJobDTO(ExportJob job, String downloadUrl) {
        this.jobId = job.getJobId();
        this.eventId = job.getEventId();
        this.status = job.getStatus();
        this.photoCount = job.getPhotoCount();
        this.downloadUrl = downloadUrl;
        this.failureReason = job.getFailureReason();
        this.createdAt = job.getCreatedAt();
        this.updatedAt = job.getUpdatedAt();
    }
}
