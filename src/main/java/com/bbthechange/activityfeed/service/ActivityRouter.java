package com.bbthechange.activityfeed.service;

import com.bbthechange.activityfeed.model.AggregationOutcome;
import com.bbthechange.activityfeed.model.DeliveryRecord;

import java.util.List;

/**
 * Turns an aggregation outcome into pending deliveries, re-checking visibility at delivery time.
 */
public interface ActivityRouter {

    /**
     * @return the delivery records written, one per recipient and stream that passed the live check
     */
    List<DeliveryRecord> route(AggregationOutcome outcome);
}
