package com.bbthechange.gallery.dto;

import com.bbthechange.gallery.model.PhotoStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class BulkModerateRequest {

    @NotNull(message = "Photo IDs are required")
    private List<String> photoIds;

    @NotNull(message = "Target approval status is required")
    private PhotoStatus approvalStatus;
}
