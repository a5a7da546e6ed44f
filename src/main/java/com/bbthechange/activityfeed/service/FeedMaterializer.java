package com.bbthechange.activityfeed.service;

import com.bbthechange.activityfeed.model.Activity;
import com.bbthechange.activityfeed.model.DeliveryRecord;

/**
 * Sink for activity-stream deliveries.
 */
public interface FeedMaterializer {

    /**
     * Write the activity into the recipient's stream and drop the entries it replaces.
     * Applying the same delivery twice leaves the stream unchanged.
     */
    void materialize(DeliveryRecord record, Activity activity);
}
