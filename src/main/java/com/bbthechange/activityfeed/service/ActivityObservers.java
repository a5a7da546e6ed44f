package com.bbthechange.activityfeed.service;

import com.bbthechange.activityfeed.model.AggregationOutcome;
import com.bbthechange.activityfeed.model.DeliveryRecord;
import com.bbthechange.activityfeed.model.StreamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fans engine progress out to every registered {@link ActivityObserver}. A failing observer is
 * logged and skipped so it cannot fail the pipeline.
 */
@Component
public class ActivityObservers {

    private static final Logger logger = LoggerFactory.getLogger(ActivityObservers.class);

    private final List<ActivityObserver> observers;

    public ActivityObservers(List<ActivityObserver> observers) {
        this.observers = List.copyOf(observers);
    }

    public void activityMaterialized(AggregationOutcome outcome, List<DeliveryRecord> deliveries) {
        for (ActivityObserver observer : observers) {
            try {
                observer.onActivityMaterialized(outcome, deliveries);
            } catch (RuntimeException e) {
                logger.warn("Observer {} failed on activity {}: {}", observer.getClass().getSimpleName(),
                        outcome.activity().getActivityId(), e.getMessage());
            }
        }
    }

    public void deliveryDrained(StreamType streamType, String bucketId, int drainedCount) {
        for (ActivityObserver observer : observers) {
            try {
                observer.onDeliveryDrained(streamType, bucketId, drainedCount);
            } catch (RuntimeException e) {
                logger.warn("Observer {} failed on drained bucket {}: {}", observer.getClass().getSimpleName(),
                        bucketId, e.getMessage());
            }
        }
    }
}
