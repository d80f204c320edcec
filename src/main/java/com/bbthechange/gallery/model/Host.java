package com.bbthechange.gallery.model;

import com.bbthechange.gallery.util.GalleryKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.util.UUID;

/**
 * Host account created the first time an identity signs in.
 *
 * Key Pattern: PK = HOST#{hostId}, SK = METADATA
 */
@DynamoDbBean
public class Host extends BaseItem {

    private String hostId;
    private String subjectId;       // identity-provider subject, unique via SubjectLink
    private String email;
    private String displayName;
    private HostStatus status;
    private long uploadedBytes;     // running total of public uploads, bounded by the host quota

    // Default constructor for DynamoDB
    public Host() {
        super();
        setItemType(GalleryKeyFactory.HOST_ITEM);
    }

    public Host(String subjectId, String email, String displayName) {
        super();
        setItemType(GalleryKeyFactory.HOST_ITEM);
        this.hostId = UUID.randomUUID().toString();
        this.subjectId = subjectId;
        this.email = email;
        this.displayName = displayName;
        this.status = HostStatus.ACTIVE;

        setPk(GalleryKeyFactory.getHostPk(this.hostId));
        setSk(GalleryKeyFactory.getMetadataSk());
    }

    public String getHostId() {
        return hostId;
    }

    public void setHostId(String hostId) {
        this.hostId = hostId;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public void setSubjectId(String subjectId) {
        this.subjectId = subjectId;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public HostStatus getStatus() {
        return status;
    }

    public void setStatus(HostStatus status) {
        this.status = status;
    }

    public long getUploadedBytes() {
        return uploadedBytes;
    }

    public void setUploadedBytes(long uploadedBytes) {
        this.uploadedBytes = uploadedBytes;
    }

    @DynamoDbIgnore
    public boolean isSuspended() {
        return status == HostStatus.SUSPENDED;
    }
}
