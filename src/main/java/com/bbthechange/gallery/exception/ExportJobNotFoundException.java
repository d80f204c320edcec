package com.bbthechange.gallery.exception;

public class ExportJobNotFoundException extends RuntimeException {

    public ExportJobNotFoundException(String message) {
        super(message);
    }
}
