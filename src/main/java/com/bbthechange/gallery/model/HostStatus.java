package com.bbthechange.gallery.model;

public enum HostStatus {
    ACTIVE,
    SUSPENDED
}
