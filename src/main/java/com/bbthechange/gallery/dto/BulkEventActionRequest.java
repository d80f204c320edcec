package com.bbthechange.gallery.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class BulkEventActionRequest {

    @NotBlank(message = "Action is required")
    private String action;

    @NotNull(message = "Event IDs are required")
    private List<String> eventIds;
}
