package com.bbthechange.gallery.service;

import org.springframework.stereotype.Component;

/**
 * Subject lines and plain-text bodies for gallery e-mails.
 */
@Component
public class NotificationTextGenerator {

    public String getSubject(GalleryNotification notification, String appName) {
        return switch (notification.getType()) {
            case HOST_WELCOMED -> String.format("Welcome to %s!", appName);
            case PHOTO_APPROVED -> String.format("Your photo from '%s' has been approved!", notification.getEventTitle());
            case PHOTO_REJECTED -> String.format("Photo from '%s' needs attention", notification.getEventTitle());
            case EXPORT_READY -> String.format("Your photo export from '%s' is ready!", notification.getEventTitle());
        };
    }

    /**
     * @param frontendUrl base URL of the web app, used for links back to the event
     */
    public String getBody(GalleryNotification notification, String appName, String frontendUrl) {
        String greeting = "Hello " + displayName(notification.getRecipientName()) + ",\n\n";
        String eventLink = frontendUrl + "/events/" + notification.getEventId();

        String body = switch (notification.getType()) {
            case HOST_WELCOMED -> String.format(
                "Welcome to %s! Create your first event and share its link to start collecting photos.%n%n%s",
                appName, frontendUrl);
            case PHOTO_APPROVED -> String.format(
                "A photo in '%s' was approved by an administrator and is now visible in the public gallery.%n%n%s",
                notification.getEventTitle(), eventLink);
            case PHOTO_REJECTED -> String.format(
                "A photo in '%s' was rejected by an administrator and is hidden from the public gallery.%n%n%s",
                notification.getEventTitle(), eventLink);
            case EXPORT_READY -> String.format(
                "Your export of '%s' (%d photos) is ready to download:%n%n%s",
                notification.getEventTitle(), notification.getPhotoCount(),
                eventLink + "/exports/" + notification.getExportJobId());
        };
        return greeting + body + "\n\nThe " + appName + " team";
    }

    private static String displayName(String name) {
        return name != null && !name.trim().isEmpty() ? name : "there";
    }
}
