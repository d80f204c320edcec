package com.bbthechange.gallery.service;

import com.bbthechange.gallery.config.UploadProperties;
import com.bbthechange.gallery.exception.ValidationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

/**
 * Checks an uploaded image against the configured content type and size limits.
 */
@Component
public class UploadValidator {

    private final UploadProperties uploadProperties;

    @Autowired
    public UploadValidator(UploadProperties uploadProperties) {
        this.uploadProperties = uploadProperties;
    }

    public void validateImage(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("File is empty");
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith(uploadProperties.getContentTypePrefix())) {
            throw new ValidationException("File must be an image");
        }
        long maxBytes = uploadProperties.getMaxFileSize().toBytes();
        if (file.getSize() > maxBytes) {
            throw new ValidationException("File size must be less than " + uploadProperties.getMaxFileSize().toMegabytes() + "MB");
        }
    }

    /**
     * @return the trimmed caption, or null when blank
     */
    public String normalizeCaption(String caption) {
        if (caption == null || caption.trim().isEmpty()) {
            return null;
        }
        String trimmed = caption.trim();
        if (trimmed.length() > uploadProperties.getMaxCaptionLength()) {
            throw new ValidationException("Caption must be at most " + uploadProperties.getMaxCaptionLength() + " characters");
        }
        return trimmed;
    }
}
