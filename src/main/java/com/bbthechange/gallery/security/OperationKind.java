package com.bbthechange.gallery.security;

/**
 * Operations the authorization guard decides on. Photo operations are checked against the owning event.
 */
public enum OperationKind {
    VIEW_EVENT(false),
    UPDATE_EVENT(false),
    PUBLISH_EVENT(false),
    DELETE_EVENT(false),
    SUSPEND_EVENT(true),
    REACTIVATE_EVENT(true),
    FORCE_DELETE_EVENT(true),
    LIST_PHOTOS(false),
    MODERATE_PHOTO(false),
    EDIT_PHOTO(false),
    REMOVE_PHOTO(false),
    EXPORT_EVENT(false);

    private final boolean adminOnly;

    OperationKind(boolean adminOnly) {
        this.adminOnly = adminOnly;
    }

    public boolean isAdminOnly() {
        return adminOnly;
    }
}
