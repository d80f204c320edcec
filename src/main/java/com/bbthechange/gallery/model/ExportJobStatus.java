package com.bbthechange.gallery.model;

public enum ExportJobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED
}
