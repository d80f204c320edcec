package com.bbthechange.gallery.dto;

import com.bbthechange.gallery.model.Host;
import com.bbthechange.gallery.model.HostStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class HostDTO {
    private String hostId;
    private String email;
    private String displayName;
    private HostStatus status;
    private long uploadedBytes;
    private Instant createdAt;
    private Instant updatedAt;

    public HostDTO(Host host) {
        this.hostId = host.getHostId();
        this.email = host.getEmail();
        this.displayName = host.getDisplayName();
        this.status = host.getStatus();
        this.uploadedBytes = host.getUploadedBytes();
        this.createdAt = host.getCreatedAt();
        this.updatedAt = host.getUpdatedAt();
    }
}
