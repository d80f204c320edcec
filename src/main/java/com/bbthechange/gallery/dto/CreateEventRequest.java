package com.bbthechange.gallery.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;

@Data
public class CreateEventRequest {

    @NotBlank(message = "Event title is required")
    @Size(max = 200, message = "Event title must be at most 200 characters")
    private String title;

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    private String description;

    private LocalDate eventDate;

    @Size(min = 4, max = 100, message = "Password must be between 4 and 100 characters")
    private String password;
}
