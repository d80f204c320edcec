package com.bbthechange.gallery.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Component
@ConfigurationProperties(prefix = "gallery.identity")
public class IdentityProperties {

    private String projectId;

    /**
     * Service-account JSON file. Application default credentials are used when empty.
     */
    private String credentialsPath;

    /**
     * Total verification attempts when the provider's signing keys cannot be fetched.
     */
    private int maxAttempts = 2;

    /**
     * Backoff before retry N is N times this value.
     */
    @DurationUnit(ChronoUnit.MILLIS)
    private Duration retryBackoff = Duration.ofMillis(200);

    private boolean checkRevoked = false;

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getCredentialsPath() {
        return credentialsPath;
    }

    public void setCredentialsPath(String credentialsPath) {
        this.credentialsPath = credentialsPath;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public boolean isCheckRevoked() {
        return checkRevoked;
    }

    public void setCheckRevoked(boolean checkRevoked) {
        this.checkRevoked = checkRevoked;
    }
}
