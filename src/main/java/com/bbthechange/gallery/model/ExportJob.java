package com.bbthechange.gallery.model;

import com.bbthechange.gallery.util.GalleryKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.util.UUID;

/**
 * Asynchronous ZIP export of an event's approved photos.
 *
 * Key Pattern: PK = EVENT#{eventId}, SK = EXPORT#{jobId}
 */
@DynamoDbBean
public class ExportJob extends BaseItem {

    private String jobId;
    private String eventId;
    private String requestedBy;
    private ExportJobStatus status;
    private String archiveRef;
    private int photoCount;
    private String failureReason;

    public ExportJob() {
        super();
        setItemType(GalleryKeyFactory.EXPORT_ITEM);
    }

    public ExportJob(String eventId, String requestedBy) {
        super();
        setItemType(GalleryKeyFactory.EXPORT_ITEM);
        this.jobId = UUID.randomUUID().toString();
        this.eventId = eventId;
        this.requestedBy = requestedBy;
        this.status = ExportJobStatus.QUEUED;

        setPk(GalleryKeyFactory.getEventPk(eventId));
        setSk(GalleryKeyFactory.getExportSk(jobId));
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getRequestedBy() {
        return requestedBy;
    }

    public void setRequestedBy(String requestedBy) {
        this.requestedBy = requestedBy;
    }

    public ExportJobStatus getStatus() {
        return status;
    }

    public void setStatus(ExportJobStatus status) {
        this.status = status;
    }

    public String getArchiveRef() {
        return archiveRef;
    }

    public void setArchiveRef(String archiveRef) {
        this.archiveRef = archiveRef;
    }

    public int getPhotoCount() {
        return photoCount;
    }

    public void setPhotoCount(int photoCount) {
        this.photoCount = photoCount;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }
}
