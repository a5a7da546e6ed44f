package com.bbthechange.activityfeed.service;

import com.bbthechange.activityfeed.model.AggregationOutcome;
import com.bbthechange.activityfeed.model.DeliveryRecord;
import com.bbthechange.activityfeed.model.StreamType;

import java.util.List;

/**
 * Hooks for components that want to react to engine progress. Implementations must not throw.
 */
public interface ActivityObserver {

    default void onActivityMaterialized(AggregationOutcome outcome, List<DeliveryRecord> deliveries) {
    }

    default void onDeliveryDrained(StreamType streamType, String bucketId, int drainedCount) {
    }
}
