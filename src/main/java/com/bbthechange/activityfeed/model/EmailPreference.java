package com.bbthechange.activityfeed.model;

/**
 * How often a user wants to receive digest emails.
 */
public enum EmailPreference {
    IMMEDIATE,
    DAILY,
    WEEKLY,
    NEVER
}
