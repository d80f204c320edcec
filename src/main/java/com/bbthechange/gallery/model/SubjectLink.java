package com.bbthechange.gallery.model;

import com.bbthechange.gallery.util.GalleryKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

/**
 * Uniqueness guard mapping an identity-provider subject to its host.
 * Written in the same transaction as the Host with attribute_not_exists(pk).
 *
 * Key Pattern: PK = SUBJECT#{subjectId}, SK = METADATA
 */
@DynamoDbBean
public class SubjectLink extends BaseItem {

    private String subjectId;
    private String hostId;

    public SubjectLink() {
        super();
        setItemType(GalleryKeyFactory.SUBJECT_ITEM);
    }

    public SubjectLink(String subjectId, String hostId) {
        super();
        setItemType(GalleryKeyFactory.SUBJECT_ITEM);
        this.subjectId = subjectId;
        this.hostId = hostId;
        setPk(GalleryKeyFactory.getSubjectPk(subjectId));
        setSk(GalleryKeyFactory.getMetadataSk());
    }

    public String getSubjectId() {
        return subjectId;
    }

    public void setSubjectId(String subjectId) {
        this.subjectId = subjectId;
    }

    public String getHostId() {
        return hostId;
    }

    public void setHostId(String hostId) {
        this.hostId = hostId;
    }
}
