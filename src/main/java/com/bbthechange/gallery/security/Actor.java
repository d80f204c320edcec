package com.bbthechange.gallery.security;

import com.bbthechange.gallery.model.Host;

/**
 * The authenticated caller of a request: its host record plus the admin flag derived
 * from the allow-list. The admin flag is never persisted.
 */
public final class Actor {

    public static final String REQUEST_ATTRIBUTE = "actor";

    private final Host host;
    private final boolean admin;

    public Actor(Host host, boolean admin) {
        this.host = host;
        this.admin = admin;
    }

    public Host getHost() {
        return host;
    }

    public String getHostId() {
        return host != null ? host.getHostId() : null;
    }

    public String getEmail() {
        return host != null ? host.getEmail() : null;
    }

    public boolean isAdmin() {
        return admin;
    }

    public boolean isSuspended() {
        return host != null && host.isSuspended();
    }

    /**
     * Value recorded in a photo's moderatedBy attribute.
     */
    public String moderatorRef() {
        return host != null ? host.getHostId() : "admin:" + getEmail();
    }

    @Override
    public String toString() {
        return "Actor{hostId=" + getHostId() + ", admin=" + admin + "}";
    }
}
