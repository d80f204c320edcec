package com.bbthechange.gallery.service;

/**
 * Fire-and-forget signals emitted by the gallery core.
 */
public enum NotificationType {
    HOST_WELCOMED,
    PHOTO_APPROVED,
    PHOTO_REJECTED,
    EXPORT_READY
}
