package com.bbthechange.activityfeed.model;

public enum StreamType {
    ACTIVITY,
    NOTIFICATION,
    EMAIL;

    public String bucketPrefix() {
        return name().toLowerCase();
    }
}
