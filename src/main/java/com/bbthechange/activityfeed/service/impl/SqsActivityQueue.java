package com.bbthechange.activityfeed.service.impl;

import com.bbthechange.activityfeed.config.ActivityProperties;
import com.bbthechange.activityfeed.model.RawEvent;
import com.bbthechange.activityfeed.service.ActivityQueue;
import com.bbthechange.activityfeed.util.RawEventCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.util.concurrent.CompletableFuture;

/**
 * SQS-backed ingest queue. Sends are asynchronous; the outcome is only logged and counted.
 */
@Service
public class SqsActivityQueue implements ActivityQueue {

    private static final Logger logger = LoggerFactory.getLogger(SqsActivityQueue.class);

    private final SqsAsyncClient sqsAsyncClient;
    private final RawEventCodec codec;
    private final MeterRegistry meterRegistry;
    private final String queueUrl;

    public SqsActivityQueue(SqsAsyncClient sqsAsyncClient,
                            RawEventCodec codec,
                            MeterRegistry meterRegistry,
                            ActivityProperties properties) {
        this.sqsAsyncClient = sqsAsyncClient;
        this.codec = codec;
        this.meterRegistry = meterRegistry;
        this.queueUrl = properties.getQueues().getIngestQueueUrl();
    }

    @Override
    public void enqueue(RawEvent event) {
        try {
            SendMessageRequest request = SendMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .messageBody(codec.toJson(event))
                    .build();

            CompletableFuture<?> future = sqsAsyncClient.sendMessage(request);

            future.whenComplete((response, error) -> {
                if (error != null) {
                    logger.error("Failed to enqueue {} event {}", event.verb(), event.eventId(), error);
                    meterRegistry.counter("activity_ingest_total", "verb", event.verb(), "status", "error").increment();
                } else {
                    logger.debug("Enqueued {} event {}", event.verb(), event.eventId());
                    meterRegistry.counter("activity_ingest_total", "verb", event.verb(), "status", "success").increment();
                }
            });

        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize {} event {}", event.verb(), event.eventId(), e);
            meterRegistry.counter("activity_ingest_total", "verb", event.verb(), "status", "serialization_error").increment();
        }
    }
}
