package com.bbthechange.gallery.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SignInRequest {

    @NotBlank(message = "Identity token is required")
    private String token;
}
