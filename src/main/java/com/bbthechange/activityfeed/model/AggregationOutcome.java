package com.bbthechange.activityfeed.model;

import java.util.List;
import java.util.Optional;

/**
 * Result of folding one event. A redundant event yields no activity and an empty delivery set.
 */
public record AggregationOutcome(Activity activity, List<String> replacedActivityIds, DeliverySet deliverySet) {

    public AggregationOutcome {
        replacedActivityIds = List.copyOf(replacedActivityIds);
    }

    public static AggregationOutcome redundant() {
        return new AggregationOutcome(null, List.of(), DeliverySet.empty());
    }

    public Optional<Activity> materialized() {
        return Optional.ofNullable(activity);
    }

    public boolean isRedundant() {
        return activity == null;
    }
}
