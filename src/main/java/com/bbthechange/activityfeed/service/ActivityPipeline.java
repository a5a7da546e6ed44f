package com.bbthechange.activityfeed.service;

import com.bbthechange.activityfeed.model.AggregationOutcome;
import com.bbthechange.activityfeed.model.DeliveryRecord;
import com.bbthechange.activityfeed.model.RawEvent;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Ingest path for one raw event: aggregate, then route whatever was materialized.
 */
@Service
public class ActivityPipeline {

    private final ActivityAggregator aggregator;
    private final ActivityRouter router;
    private final ActivityObservers observers;

    public ActivityPipeline(ActivityAggregator aggregator, ActivityRouter router, ActivityObservers observers) {
        this.aggregator = aggregator;
        this.router = router;
        this.observers = observers;
    }

    /**
     * @return the delivery records written, empty if the event added nothing new
     */
    public List<DeliveryRecord> process(RawEvent event) {
        AggregationOutcome outcome = aggregator.aggregate(event);
        if (outcome.isRedundant()) {
            return List.of();
        }
        List<DeliveryRecord> deliveries = router.route(outcome);
        observers.activityMaterialized(outcome, deliveries);
        return deliveries;
    }
}
