package com.bbthechange.activityfeed.service.impl;

import com.bbthechange.activityfeed.config.ActivityProperties;
import com.bbthechange.activityfeed.model.Activity;
import com.bbthechange.activityfeed.model.BucketCollectionResult;
import com.bbthechange.activityfeed.model.DeliveryRecord;
import com.bbthechange.activityfeed.model.EmailDigest;
import com.bbthechange.activityfeed.model.StreamType;
import com.bbthechange.activityfeed.repository.ActivityRepository;
import com.bbthechange.activityfeed.repository.DeliveryRecordRepository;
import com.bbthechange.activityfeed.service.EmailCollector;
import com.bbthechange.activityfeed.service.EmailDigestSink;
import com.bbthechange.activityfeed.util.BucketAssigner;
import com.bbthechange.activityfeed.util.EmailSchedule;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drains email buckets into one digest per recipient.
 *
 * A recipient is held back while any of their pending activities is younger than the grace
 * period, so a burst of related events that is still being aggregated goes out as one mail.
 * Activities that were replaced while waiting are dropped; if nothing is left the recipient's
 * records are removed without sending anything.
 */
@Service
public class EmailCollectorImpl implements EmailCollector {

    private static final Logger logger = LoggerFactory.getLogger(EmailCollectorImpl.class);

    private final BucketLeaseRunner leaseRunner;
    private final DeliveryRecordRepository deliveryRecordRepository;
    private final ActivityRepository activityRepository;
    private final EmailDigestSink digestSink;
    private final EmailSchedule emailSchedule;
    private final ActivityProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public EmailCollectorImpl(BucketLeaseRunner leaseRunner,
                              DeliveryRecordRepository deliveryRecordRepository,
                              ActivityRepository activityRepository,
                              EmailDigestSink digestSink,
                              EmailSchedule emailSchedule,
                              ActivityProperties properties,
                              MeterRegistry meterRegistry,
                              Clock clock) {
        this.leaseRunner = leaseRunner;
        this.deliveryRecordRepository = deliveryRecordRepository;
        this.activityRepository = activityRepository;
        this.digestSink = digestSink;
        this.emailSchedule = emailSchedule;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Override
    public Map<String, BucketCollectionResult> collectAllBuckets(Instant now) {
        boolean dailyDue = emailSchedule.isDailyCycle(now);
        boolean weeklyDue = emailSchedule.isWeeklyCycle(now);

        return leaseRunner.sweep(StreamType.EMAIL, () -> {
            Map<String, BucketCollectionResult> results = new LinkedHashMap<>();
            for (int n = 0; n < properties.getNumberOfBuckets(); n++) {
                if (leaseRunner.isShuttingDown()) {
                    break;
                }
                List<String> bucketIds = new ArrayList<>();
                bucketIds.add(BucketAssigner.immediateEmailBucketId(n));
                if (dailyDue) {
                    bucketIds.add(BucketAssigner.dailyEmailBucketId(n, emailSchedule.dailySlotHour(now)));
                }
                if (weeklyDue) {
                    bucketIds.add(BucketAssigner.weeklyEmailBucketId(n,
                            emailSchedule.weeklySlotDay(now), emailSchedule.weeklySlotHour(now)));
                }
                for (String bucketId : bucketIds) {
                    results.put(bucketId, collectBucket(bucketId));
                }
            }
            return results;
        });
    }

    @Override
    public BucketCollectionResult collectBucket(String bucketId) {
        return leaseRunner.collect(StreamType.EMAIL, bucketId, properties.getMail().getPollingFrequency(),
                this::drainBatch);
    }

    @Override
    public void shutdown() {
        leaseRunner.shutdown();
    }

    private BucketLeaseRunner.DrainedBatch drainBatch(String bucketId) {
        int batchSize = properties.getCollection().getBatchSize();
        List<DeliveryRecord> records = deliveryRecordRepository.findByBucket(bucketId, batchSize);

        Map<String, List<DeliveryRecord>> byRecipient = new LinkedHashMap<>();
        for (DeliveryRecord record : records) {
            byRecipient.computeIfAbsent(record.getRecipientId(), r -> new ArrayList<>()).add(record);
        }

        Instant now = clock.instant();
        Instant settledBefore = now.minus(properties.getMail().getGracePeriod());
        int drained = 0;
        for (Map.Entry<String, List<DeliveryRecord>> entry : byRecipient.entrySet()) {
            String recipientId = entry.getKey();
            List<DeliveryRecord> pending = entry.getValue();

            if (pending.stream().anyMatch(r -> r.getPublishedAt() != null && r.getPublishedAt().isAfter(settledBefore))) {
                logger.debug("Holding email for {} in {}, activity still settling", recipientId, bucketId);
                meterRegistry.counter("activity_email_deferred_total").increment();
                continue;
            }

            List<EmailDigest.DigestItem> items = liveActivities(pending).stream()
                    .map(EmailDigest.DigestItem::of)
                    .toList();
            if (!items.isEmpty()) {
                digestSink.send(new EmailDigest(recipientId, BucketAssigner.emailPreferenceOf(bucketId), items, now));
            } else {
                logger.debug("All pending activities for {} were replaced, nothing to send", recipientId);
            }

            pending.forEach(deliveryRecordRepository::delete);
            drained += pending.size();
        }

        boolean exhausted = records.size() < batchSize || drained == 0;
        return new BucketLeaseRunner.DrainedBatch(drained, exhausted);
    }

    private List<Activity> liveActivities(List<DeliveryRecord> pending) {
        Map<String, Activity> live = new LinkedHashMap<>();
        for (DeliveryRecord record : pending) {
            if (live.containsKey(record.getActivityId())) {
                continue;
            }
            Optional<Activity> activity = activityRepository.findById(record.getActivityId());
            activity.ifPresent(a -> live.put(a.getActivityId(), a));
        }
        return new ArrayList<>(live.values());
    }
}
