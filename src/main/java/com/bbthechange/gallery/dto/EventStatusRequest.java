package com.bbthechange.gallery.dto;

import com.bbthechange.gallery.model.EventStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class EventStatusRequest {

    @NotNull(message = "Status is required")
    private EventStatus status;
}
