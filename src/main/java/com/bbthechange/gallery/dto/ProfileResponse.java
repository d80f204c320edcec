package com.bbthechange.gallery.dto;

import com.bbthechange.gallery.model.Host;
import com.bbthechange.gallery.model.HostStatus;
import com.bbthechange.gallery.security.Actor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class ProfileResponse {
    private String hostId;
    private String email;
    private String displayName;
    private HostStatus status;
    private boolean admin;
    private long uploadedBytes;
    private Instant createdAt;

    public ProfileResponse(Actor actor) {
        Host host = actor.getHost();
        this.hostId = host.getHostId();
        this.email = host.getEmail();
        this.displayName = host.getDisplayName();
        this.status = host.getStatus();
        this.admin = actor.isAdmin();
        this.uploadedBytes = host.getUploadedBytes();
        this.createdAt = host.getCreatedAt();
    }
}
