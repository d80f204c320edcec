package com.bbthechange.gallery.dto;

import lombok.Data;

@Data
public class PasswordCheckRequest {
    private String password;
}
