package com.bbthechange.gallery.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class BulkPhotoDeleteRequest {

    @NotNull(message = "Photo IDs are required")
    private List<String> photoIds;
}
