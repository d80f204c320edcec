package com.bbthechange.gallery.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Component
@ConfigurationProperties(prefix = "gallery.share")
public class ShareProperties {

    /**
     * Whether an event password also guards public uploads, not only viewing.
     */
    private boolean passwordGatesUploads = true;

    @DurationUnit(ChronoUnit.MINUTES)
    private Duration photoUrlTtl = Duration.ofMinutes(60);

    public boolean isPasswordGatesUploads() {
        return passwordGatesUploads;
    }

    public void setPasswordGatesUploads(boolean passwordGatesUploads) {
        this.passwordGatesUploads = passwordGatesUploads;
    }

    public Duration getPhotoUrlTtl() {
        return photoUrlTtl;
    }

    public void setPhotoUrlTtl(Duration photoUrlTtl) {
        this.photoUrlTtl = photoUrlTtl;
    }
}
