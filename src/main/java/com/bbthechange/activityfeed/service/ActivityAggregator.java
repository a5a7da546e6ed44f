package com.bbthechange.activityfeed.service;

import com.bbthechange.activityfeed.model.AggregationOutcome;
import com.bbthechange.activityfeed.model.RawEvent;

/**
 * Folds raw events into aggregates and materializes the activity that represents them.
 */
public interface ActivityAggregator {

    /**
     * Process one event.
     *
     * @return the new activity with the ids it replaces and its candidate recipients, or a
     *         redundant outcome when an active aggregate already contains the event
     * @throws com.bbthechange.activityfeed.exception.EventValidationException for malformed events
     * @throws com.bbthechange.activityfeed.exception.ConflictException when concurrent writers keep winning
     * @throws com.bbthechange.activityfeed.exception.TransientStoreException when the store fails
     */
    AggregationOutcome aggregate(RawEvent event);
}
