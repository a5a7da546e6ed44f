package com.bbthechange.activityfeed.model;

/**
 * The entity slots of an activity. Grouping rules hold some of them fixed and let the rest vary.
 */
public enum PivotField {
    ACTOR,
    OBJECT,
    TARGET
}
