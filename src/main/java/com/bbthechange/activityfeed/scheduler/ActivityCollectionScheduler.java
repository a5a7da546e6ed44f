package com.bbthechange.activityfeed.scheduler;

import com.bbthechange.activityfeed.model.BucketCollectionResult;
import com.bbthechange.activityfeed.model.StreamType;
import com.bbthechange.activityfeed.service.BucketCollector;
import com.bbthechange.activityfeed.service.EmailCollector;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Periodic bucket sweeps. Any number of processes may run these; the bucket leases keep them
 * from draining the same bucket at once.
 */
@Component
@ConditionalOnProperty(name = "activity.processing.enabled", havingValue = "true", matchIfMissing = true)
public class ActivityCollectionScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ActivityCollectionScheduler.class);

    private final BucketCollector bucketCollector;
    private final EmailCollector emailCollector;
    private final Clock clock;

    public ActivityCollectionScheduler(BucketCollector bucketCollector, EmailCollector emailCollector, Clock clock) {
        this.bucketCollector = bucketCollector;
        this.emailCollector = emailCollector;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${activity.collection.activity-interval:PT10S}")
    public void collectActivityBuckets() {
        logSweep(StreamType.ACTIVITY, bucketCollector.collectAllBuckets(StreamType.ACTIVITY));
    }

    @Scheduled(fixedDelayString = "${activity.collection.notification-interval:PT10S}")
    public void collectNotificationBuckets() {
        logSweep(StreamType.NOTIFICATION, bucketCollector.collectAllBuckets(StreamType.NOTIFICATION));
    }

    @Scheduled(fixedDelayString = "${activity.mail.polling-frequency:PT15M}")
    public void collectEmailBuckets() {
        logSweep(StreamType.EMAIL, emailCollector.collectAllBuckets(clock.instant()));
    }

    @PreDestroy
    public void shutdown() {
        bucketCollector.shutdown();
        emailCollector.shutdown();
    }

    private void logSweep(StreamType streamType, Map<String, BucketCollectionResult> results) {
        long failed = results.values().stream().filter(r -> r == BucketCollectionResult.FAILED).count();
        if (failed > 0) {
            logger.warn("{} sweep finished with {} failed buckets: {}", streamType, failed, results);
        } else {
            logger.debug("{} sweep finished: {}", streamType, results);
        }
    }
}
