package com.bbthechange.gallery.dto;

import com.bbthechange.gallery.model.PhotoStatus;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Moderate a photo, edit its caption, or both. An empty caption removes it.
 */
@Data
public class UpdatePhotoRequest {

    private PhotoStatus approvalStatus;

    @Size(max = 500, message = "Caption must be at most 500 characters")
    private String caption;
}
