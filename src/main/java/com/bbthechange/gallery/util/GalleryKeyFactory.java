package com.bbthechange.gallery.util;

import com.bbthechange.gallery.exception.InvalidKeyException;

import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Type-safe key factory for DynamoDB single-table design.
 * Provides validated key generation for the GalleryTable with consistent patterns.
 */
public final class GalleryKeyFactory {
    private static final String DELIMITER = "#";
    private static final Pattern UUID_PATTERN = Pattern.compile(
        "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern SHARE_TOKEN_PATTERN = Pattern.compile("[a-z0-9]{6,64}");

    // Constants for magic strings
    public static final String HOST_PREFIX = "HOST";
    public static final String SUBJECT_PREFIX = "SUBJECT";
    public static final String EVENT_PREFIX = "EVENT";
    public static final String PHOTO_PREFIX = "PHOTO";
    public static final String EXPORT_PREFIX = "EXPORT";
    public static final String SHARE_PREFIX = "SHARE";
    public static final String CREATED_PREFIX = "CREATED";
    public static final String METADATA_SUFFIX = "METADATA";

    // Item type discriminators
    public static final String HOST_ITEM = "Host";
    public static final String SUBJECT_ITEM = "SubjectLink";
    public static final String EVENT_ITEM = "Event";
    public static final String PHOTO_ITEM = "Photo";
    public static final String EXPORT_ITEM = "ExportJob";

    private GalleryKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static void validateId(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidKeyException(type + " ID cannot be null or empty");
        }
        if (!UUID_PATTERN.matcher(id).matches()) {
            throw new InvalidKeyException("Invalid " + type + " ID format: " + id);
        }
    }

    public static String getMetadataSk() {
        return METADATA_SUFFIX;
    }

    public static boolean isMetadata(String sortKey) {
        return METADATA_SUFFIX.equals(sortKey);
    }

    // Host keys

    public static String getHostPk(String hostId) {
        validateId(hostId, "Host");
        return HOST_PREFIX + DELIMITER + hostId;
    }

    /**
     * Subject ids come from the identity provider and are not UUIDs, so only the
     * delimiter is rejected.
     */
    public static String getSubjectPk(String subjectId) {
        if (subjectId == null || subjectId.trim().isEmpty()) {
            throw new InvalidKeyException("Subject ID cannot be null or empty");
        }
        if (subjectId.contains(DELIMITER)) {
            throw new InvalidKeyException("Invalid subject ID format: " + subjectId);
        }
        return SUBJECT_PREFIX + DELIMITER + subjectId;
    }

    // Event keys

    public static String getEventPk(String eventId) {
        validateId(eventId, "Event");
        return EVENT_PREFIX + DELIMITER + eventId;
    }

    public static String getHostEventsGsi1pk(String hostId) {
        return getHostPk(hostId);
    }

    public static String getCreatedSk(Instant createdAt) {
        if (createdAt == null) {
            throw new InvalidKeyException("CreatedAt cannot be null");
        }
        return CREATED_PREFIX + DELIMITER + createdAt.toString();
    }

    public static String getShareTokenGsi2pk(String shareToken) {
        if (shareToken == null || !SHARE_TOKEN_PATTERN.matcher(shareToken).matches()) {
            throw new InvalidKeyException("Invalid share token format");
        }
        return SHARE_PREFIX + DELIMITER + shareToken;
    }

    public static boolean isValidShareToken(String shareToken) {
        return shareToken != null && SHARE_TOKEN_PATTERN.matcher(shareToken).matches();
    }

    // Photo keys

    public static String getPhotoSk(String photoId) {
        validateId(photoId, "Photo");
        return PHOTO_PREFIX + DELIMITER + photoId;
    }

    public static String getPhotoPrefix() {
        return PHOTO_PREFIX + DELIMITER;
    }

    public static boolean isPhotoItem(String sortKey) {
        return sortKey != null && sortKey.startsWith(PHOTO_PREFIX + DELIMITER);
    }

    // Export job keys

    public static String getExportSk(String jobId) {
        validateId(jobId, "Export job");
        return EXPORT_PREFIX + DELIMITER + jobId;
    }

    public static boolean isExportItem(String sortKey) {
        return sortKey != null && sortKey.startsWith(EXPORT_PREFIX + DELIMITER);
    }

    public static boolean isValidId(String id) {
        return id != null && UUID_PATTERN.matcher(id).matches();
    }
}
