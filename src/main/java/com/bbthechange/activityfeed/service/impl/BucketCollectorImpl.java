package com.bbthechange.activityfeed.service.impl;

import com.bbthechange.activityfeed.config.ActivityProperties;
import com.bbthechange.activityfeed.model.Activity;
import com.bbthechange.activityfeed.model.BucketCollectionResult;
import com.bbthechange.activityfeed.model.DeliveryRecord;
import com.bbthechange.activityfeed.model.StreamType;
import com.bbthechange.activityfeed.repository.ActivityRepository;
import com.bbthechange.activityfeed.repository.DeliveryRecordRepository;
import com.bbthechange.activityfeed.service.BucketCollector;
import com.bbthechange.activityfeed.service.FeedMaterializer;
import com.bbthechange.activityfeed.service.NotificationService;
import com.bbthechange.activityfeed.util.BucketAssigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drains activity and notification buckets. Each record is handed to its sink and then removed;
 * a record whose activity has since been replaced is removed without delivery, since the
 * replacing activity carries its own record.
 */
@Service
public class BucketCollectorImpl implements BucketCollector {

    private static final Logger logger = LoggerFactory.getLogger(BucketCollectorImpl.class);

    private final BucketLeaseRunner leaseRunner;
    private final DeliveryRecordRepository deliveryRecordRepository;
    private final ActivityRepository activityRepository;
    private final FeedMaterializer feedMaterializer;
    private final NotificationService notificationService;
    private final ActivityProperties properties;

    public BucketCollectorImpl(BucketLeaseRunner leaseRunner,
                               DeliveryRecordRepository deliveryRecordRepository,
                               ActivityRepository activityRepository,
                               FeedMaterializer feedMaterializer,
                               NotificationService notificationService,
                               ActivityProperties properties) {
        this.leaseRunner = leaseRunner;
        this.deliveryRecordRepository = deliveryRecordRepository;
        this.activityRepository = activityRepository;
        this.feedMaterializer = feedMaterializer;
        this.notificationService = notificationService;
        this.properties = properties;
    }

    @Override
    public BucketCollectionResult collectBucket(StreamType streamType, int bucketNumber) {
        requireFeedStream(streamType);
        String bucketId = BucketAssigner.bucketId(streamType, bucketNumber);
        return leaseRunner.collect(streamType, bucketId, properties.getCollection().getLeaseDuration(),
                id -> drainBatch(streamType, id));
    }

    @Override
    public Map<String, BucketCollectionResult> collectAllBuckets(StreamType streamType) {
        requireFeedStream(streamType);
        return leaseRunner.sweep(streamType, () -> {
            Map<String, BucketCollectionResult> results = new LinkedHashMap<>();
            for (int n = 0; n < properties.getNumberOfBuckets(); n++) {
                if (leaseRunner.isShuttingDown()) {
                    break;
                }
                results.put(BucketAssigner.bucketId(streamType, n), collectBucket(streamType, n));
            }
            return results;
        });
    }

    @Override
    public void shutdown() {
        leaseRunner.shutdown();
    }

    private BucketLeaseRunner.DrainedBatch drainBatch(StreamType streamType, String bucketId) {
        int batchSize = properties.getCollection().getBatchSize();
        List<DeliveryRecord> records = deliveryRecordRepository.findByBucket(bucketId, batchSize);

        for (DeliveryRecord record : records) {
            Optional<Activity> activity = activityRepository.findById(record.getActivityId());
            if (activity.isPresent()) {
                deliver(streamType, record, activity.get());
            } else {
                logger.debug("Activity {} no longer exists, dropping delivery to {}",
                        record.getActivityId(), record.getRecipientId());
            }
            deliveryRecordRepository.delete(record);
        }
        return new BucketLeaseRunner.DrainedBatch(records.size(), records.size() < batchSize);
    }

    private void deliver(StreamType streamType, DeliveryRecord record, Activity activity) {
        switch (streamType) {
            case ACTIVITY -> feedMaterializer.materialize(record, activity);
            case NOTIFICATION -> notificationService.deliver(record, activity);
            default -> throw new IllegalStateException("Unexpected stream " + streamType);
        }
    }

    private static void requireFeedStream(StreamType streamType) {
        if (streamType == StreamType.EMAIL) {
            throw new IllegalArgumentException("Email buckets are drained by the email collector");
        }
    }
}
