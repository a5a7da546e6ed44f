package com.bbthechange.activityfeed.model;

/**
 * Identity of one aggregate: a rule applied to one combination of pivot values in one time bucket.
 */
public record GroupKey(String value, String ruleId, long timeBucket) {

    @Override
    public String toString() {
        return value;
    }
}
