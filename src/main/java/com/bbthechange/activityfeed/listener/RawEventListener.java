package com.bbthechange.activityfeed.listener;

import com.bbthechange.activityfeed.exception.ConflictException;
import com.bbthechange.activityfeed.exception.EventValidationException;
import com.bbthechange.activityfeed.model.DeliveryRecord;
import com.bbthechange.activityfeed.model.RawEvent;
import com.bbthechange.activityfeed.service.ActivityPipeline;
import com.bbthechange.activityfeed.util.RawEventCodec;
import io.awspring.cloud.sqs.annotation.SqsListener;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * SQS listener for raw events.
 *
 * Message format: {"verb":"...","actorId":"...","objectId":"...","targetId":"...","timestamp":...}
 *
 * Malformed events are acknowledged and dropped, since redelivery cannot fix them. Everything
 * else is rethrown so the message becomes visible again and is retried; aggregation is
 * idempotent, so a retried event that was already merged is recognised as redundant.
 */
@Component
@ConditionalOnProperty(name = "activity.processing.enabled", havingValue = "true", matchIfMissing = true)
public class RawEventListener {

    private static final Logger logger = LoggerFactory.getLogger(RawEventListener.class);

    private final RawEventCodec codec;
    private final ActivityPipeline pipeline;
    private final MeterRegistry meterRegistry;

    public RawEventListener(RawEventCodec codec, ActivityPipeline pipeline, MeterRegistry meterRegistry) {
        this.codec = codec;
        this.pipeline = pipeline;
        this.meterRegistry = meterRegistry;
    }

    @SqsListener(value = "${activity.queues.ingest-queue-name:activity-events}")
    public void handleEvent(String messageBody) {
        RawEvent event;
        try {
            event = codec.fromJson(messageBody);
        } catch (EventValidationException e) {
            logger.warn("Dropping malformed event: {} ({})", messageBody, e.getMessage());
            meterRegistry.counter("activity_event_total", "status", "invalid").increment();
            return;
        }

        try {
            List<DeliveryRecord> deliveries = pipeline.process(event);
            String status = deliveries.isEmpty() ? "no_delivery" : "routed";
            meterRegistry.counter("activity_event_total", "status", status).increment();
        } catch (EventValidationException e) {
            logger.warn("Dropping event {} {} -> {}: {}", event.verb(), event.actorId(), event.objectId(), e.getMessage());
            meterRegistry.counter("activity_event_total", "status", "invalid").increment();
        } catch (ConflictException e) {
            logger.warn("Event {} {} -> {} kept conflicting, leaving it for redelivery",
                    event.verb(), event.actorId(), event.objectId());
            meterRegistry.counter("activity_event_total", "status", "conflict").increment();
            throw e;
        } catch (RuntimeException e) {
            logger.error("Error processing event {} {} -> {}", event.verb(), event.actorId(), event.objectId(), e);
            meterRegistry.counter("activity_event_total", "status", "error").increment();
            throw e;
        }
    }
}
