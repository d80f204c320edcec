package com.bbthechange.gallery.exception;

public class HostNotFoundException extends RuntimeException {

    public HostNotFoundException(String message) {
        super(message);
    }
}
