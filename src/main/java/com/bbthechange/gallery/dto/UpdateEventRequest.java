package com.bbthechange.gallery.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;

/**
 * Partial update: only non-null fields are applied.
 */
@Data
public class UpdateEventRequest {

    @Size(min = 1, max = 200, message = "Event title must be between 1 and 200 characters")
    private String title;

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    private String description;

    private LocalDate eventDate;

    @Size(min = 4, max = 100, message = "Password must be between 4 and 100 characters")
    private String password;

    private Boolean removePassword;

    public boolean hasChanges() {
        return title != null || description != null || eventDate != null
            || password != null || Boolean.TRUE.equals(removePassword);
    }
}
