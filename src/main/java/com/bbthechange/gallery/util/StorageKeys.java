package com.bbthechange.gallery.util;

import java.util.Locale;
import java.util.UUID;

/**
 * Object storage key layout. Keys are grouped per event so an event's objects share a prefix.
 */
public final class StorageKeys {

    private StorageKeys() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String photoKey(String eventId, String photoId, String contentType) {
        return "events/" + eventId + "/photos/" + photoId + extension(contentType);
    }

    public static String coverKey(String eventId, String contentType) {
        return "events/" + eventId + "/cover/" + UUID.randomUUID() + extension(contentType);
    }

    public static String exportKey(String eventId, String jobId) {
        return "exports/" + eventId + "/" + jobId + ".zip";
    }

    static String extension(String contentType) {
        if (contentType == null) {
            return "";
        }
        int slash = contentType.indexOf('/');
        if (slash < 0 || slash == contentType.length() - 1) {
            return "";
        }
        String subtype = contentType.substring(slash + 1).toLowerCase(Locale.ROOT);
        int param = subtype.indexOf(';');
        if (param >= 0) {
            subtype = subtype.substring(0, param).trim();
        }
        int plus = subtype.indexOf('+');
        if (plus >= 0) {
            subtype = subtype.substring(0, plus);
        }
        if (subtype.isEmpty() || !subtype.matches("[a-z0-9.-]+")) {
            return "";
        }
        return "." + ("jpeg".equals(subtype) ? "jpg" : subtype);
    }
}
