package com.bbthechange.gallery.dto;

import com.bbthechange.gallery.model.HostStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class HostStatusRequest {

    @NotNull(message = "Status is required")
    private HostStatus status;
}
