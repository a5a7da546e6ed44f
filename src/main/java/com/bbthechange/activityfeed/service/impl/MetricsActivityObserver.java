package com.bbthechange.activityfeed.service.impl;

import com.bbthechange.activityfeed.model.AggregationOutcome;
import com.bbthechange.activityfeed.model.DeliveryRecord;
import com.bbthechange.activityfeed.model.StreamType;
import com.bbthechange.activityfeed.service.ActivityObserver;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Records engine progress as Micrometer meters.
 */
@Component
public class MetricsActivityObserver implements ActivityObserver {

    private final MeterRegistry meterRegistry;

    public MetricsActivityObserver(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void onActivityMaterialized(AggregationOutcome outcome, List<DeliveryRecord> deliveries) {
        String kind = outcome.replacedActivityIds().isEmpty() ? "created" : "replaced";
        meterRegistry.counter("activity_materialized_total", "verb", outcome.activity().getVerb(), "kind", kind)
                .increment();
        meterRegistry.summary("activity_deliveries_per_activity").record(deliveries.size());
    }

    @Override
    public void onDeliveryDrained(StreamType streamType, String bucketId, int drainedCount) {
        meterRegistry.counter("activity_drained_total", "stream", streamType.name()).increment(drainedCount);
    }
}
