package com.bbthechange.gallery.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DataSizeUnit;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.util.unit.DataUnit;

@Component
@ConfigurationProperties(prefix = "gallery.upload")
public class UploadProperties {

    @DataSizeUnit(DataUnit.BYTES)
    private DataSize maxFileSize = DataSize.ofMegabytes(10);

    @DataSizeUnit(DataUnit.BYTES)
    private DataSize hostQuota = DataSize.ofGigabytes(1);

    private String contentTypePrefix = "image/";

    private int maxCaptionLength = 500;

    public DataSize getMaxFileSize() {
        return maxFileSize;
    }

    public void setMaxFileSize(DataSize maxFileSize) {
        this.maxFileSize = maxFileSize;
    }

    public DataSize getHostQuota() {
        return hostQuota;
    }

    public void setHostQuota(DataSize hostQuota) {
        this.hostQuota = hostQuota;
    }

    public String getContentTypePrefix() {
        return contentTypePrefix;
    }

    public void setContentTypePrefix(String contentTypePrefix) {
        this.contentTypePrefix = contentTypePrefix;
    }

    public int getMaxCaptionLength() {
        return maxCaptionLength;
    }

    public void setMaxCaptionLength(int maxCaptionLength) {
        this.maxCaptionLength = maxCaptionLength;
    }
}
