package com.bbthechange.gallery.service;

/**
 * Application event carrying one notification to one recipient.
 */
public class GalleryNotification {

    private final NotificationType type;
    private final String recipientEmail;
    private final String recipientName;
    private final String eventId;
    private final String eventTitle;
    private final int photoCount;
    private final String exportJobId;

    private GalleryNotification(NotificationType type, String recipientEmail, String recipientName,
                                String eventId, String eventTitle, int photoCount, String exportJobId) {
        this.type = type;
        this.recipientEmail = recipientEmail;
        this.recipientName = recipientName;
        this.eventId = eventId;
        this.eventTitle = eventTitle;
        this.photoCount = photoCount;
        this.exportJobId = exportJobId;
    }

    public static GalleryNotification hostWelcomed(String email, String name) {
        return new GalleryNotification(NotificationType.HOST_WELCOMED, email, name, null, null, 0, null);
    }

    public static GalleryNotification photoModerated(NotificationType type, String email, String name,
                                                     String eventId, String eventTitle) {
        return new GalleryNotification(type, email, name, eventId, eventTitle, 0, null);
    }

    public static GalleryNotification exportReady(String email, String name, String eventId, String eventTitle,
                                                  int photoCount, String exportJobId) {
        return new GalleryNotification(NotificationType.EXPORT_READY, email, name, eventId, eventTitle,
            photoCount, exportJobId);
    }

    public NotificationType getType() {
        return type;
    }

    public String getRecipientEmail() {
        return recipientEmail;
    }

    public String getRecipientName() {
        return recipientName;
    }

    public String getEventId() {
        return eventId;
    }

    public String getEventTitle() {
        return eventTitle;
    }

    public int getPhotoCount() {
        return photoCount;
    }

    public String getExportJobId() {
        return exportJobId;
    }

    @Override
    public String toString() {
        return "GalleryNotification{type=" + type + ", eventId=" + eventId + "}";
    }
}
