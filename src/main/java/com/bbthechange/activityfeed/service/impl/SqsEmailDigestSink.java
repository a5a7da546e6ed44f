package com.bbthechange.activityfeed.service.impl;

import com.bbthechange.activityfeed.config.ActivityProperties;
import com.bbthechange.activityfeed.exception.DigestHandoffException;
import com.bbthechange.activityfeed.model.EmailDigest;
import com.bbthechange.activityfeed.service.EmailDigestSink;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.util.concurrent.CompletionException;

/**
 * Publishes digests to the mail queue. Unlike ingest, the send is awaited: the collector only
 * deletes a recipient's deliveries once the digest is safely queued.
 */
@Service
public class SqsEmailDigestSink implements EmailDigestSink {

    private static final Logger logger = LoggerFactory.getLogger(SqsEmailDigestSink.class);

    private final SqsAsyncClient sqsAsyncClient;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final String queueUrl;

    public SqsEmailDigestSink(SqsAsyncClient sqsAsyncClient,
                              ObjectMapper objectMapper,
                              MeterRegistry meterRegistry,
                              ActivityProperties properties) {
        this.sqsAsyncClient = sqsAsyncClient;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.queueUrl = properties.getQueues().getEmailDigestQueueUrl();
    }

    @Override
    public void send(EmailDigest digest) {
        try {
            SendMessageRequest request = SendMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .messageBody(objectMapper.writeValueAsString(digest))
                    .build();
            sqsAsyncClient.sendMessage(request).join();

            logger.info("Queued {} digest for {} with {} activities",
                    digest.preference(), digest.recipientId(), digest.activities().size());
            meterRegistry.counter("activity_email_digest_total", "status", "sent").increment();

        } catch (JsonProcessingException e) {
            meterRegistry.counter("activity_email_digest_total", "status", "serialization_error").increment();
            throw new DigestHandoffException("Failed to serialize digest for " + digest.recipientId(), e);
        } catch (CompletionException e) {
            meterRegistry.counter("activity_email_digest_total", "status", "error").increment();
            throw new DigestHandoffException("Failed to queue digest for " + digest.recipientId(), e.getCause());
        }
    }
}
