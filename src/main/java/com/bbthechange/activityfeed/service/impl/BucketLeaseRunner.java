package com.bbthechange.activityfeed.service.impl;

import com.bbthechange.activityfeed.config.ActivityProperties;
import com.bbthechange.activityfeed.model.BucketCollectionResult;
import com.bbthechange.activityfeed.model.StreamType;
import com.bbthechange.activityfeed.repository.BucketLeaseRepository;
import com.bbthechange.activityfeed.service.ActivityObservers;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs bucket drains under the bucket lease.
 *
 * A bucket is Pending until a collector takes its lease, Draining while the lease is held, and
 * back to Pending once the lease is released, whether the drain succeeded or failed. A lease
 * that outlives its duration may be taken by another collector; the releasing collector finds
 * out and logs it, since both may then have handled the same records.
 */
@Component
public class BucketLeaseRunner {

    private static final Logger logger = LoggerFactory.getLogger(BucketLeaseRunner.class);

    private final BucketLeaseRepository leaseRepository;
    private final ActivityObservers observers;
    private final ActivityProperties properties;
    private final MeterRegistry meterRegistry;
    private final Map<StreamType, AtomicInteger> runningSweeps = new EnumMap<>(StreamType.class);
    private volatile boolean shuttingDown;

    public BucketLeaseRunner(BucketLeaseRepository leaseRepository,
                             ActivityObservers observers,
                             ActivityProperties properties,
                             MeterRegistry meterRegistry) {
        this.leaseRepository = leaseRepository;
        this.observers = observers;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        for (StreamType streamType : StreamType.values()) {
            runningSweeps.put(streamType, new AtomicInteger());
        }
    }

    /**
     * One page of a drain.
     *
     * @param drained  records removed from the bucket
     * @param exhausted true when the bucket has nothing more to offer this pass
     */
    public record DrainedBatch(int drained, boolean exhausted) {
    }

    @FunctionalInterface
    public interface BatchDrainer {
        DrainedBatch drainNext(String bucketId);
    }

    /**
     * Sweep every bucket of a stream, unless this process already runs as many sweeps of the
     * stream as it is allowed to. Returns an empty map in that case.
     */
    public Map<String, BucketCollectionResult> sweep(StreamType streamType,
                                                    Supplier<Map<String, BucketCollectionResult>> sweep) {
        AtomicInteger running = runningSweeps.get(streamType);
        int maxConcurrent = properties.getCollection().getMaxConcurrentCollections();
        if (running.incrementAndGet() > maxConcurrent) {
            running.decrementAndGet();
            logger.info("Skipping {} collection, {} already running", streamType, maxConcurrent);
            return Map.of();
        }
        try {
            return sweep.get();
        } finally {
            running.decrementAndGet();
        }
    }

    public BucketCollectionResult collect(StreamType streamType, String bucketId, Duration leaseDuration,
                                          BatchDrainer drainer) {
        if (shuttingDown) {
            return record(streamType, BucketCollectionResult.ABORTED);
        }

        Optional<String> lease = leaseRepository.tryAcquire(bucketId, leaseDuration);
        if (lease.isEmpty()) {
            logger.debug("Bucket {} is being drained elsewhere", bucketId);
            return record(streamType, BucketCollectionResult.CONTENDED);
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        int total = 0;
        BucketCollectionResult result;
        try {
            result = BucketCollectionResult.DRAINED;
            while (true) {
                if (shuttingDown) {
                    result = BucketCollectionResult.ABORTED;
                    break;
                }
                DrainedBatch batch = drainer.drainNext(bucketId);
                total += batch.drained();
                if (batch.exhausted()) {
                    break;
                }
            }
        } catch (RuntimeException e) {
            logger.error("Failed to drain bucket {} after {} records", bucketId, total, e);
            result = BucketCollectionResult.FAILED;
        } finally {
            release(bucketId, lease.get());
            sample.stop(Timer.builder("activity_collection_duration")
                    .tag("stream", streamType.name())
                    .register(meterRegistry));
        }

        if (result == BucketCollectionResult.DRAINED && total > 0) {
            logger.info("Drained {} records from bucket {}", total, bucketId);
            observers.deliveryDrained(streamType, bucketId, total);
        }
        return record(streamType, result);
    }

    public void shutdown() {
        logger.info("Bucket collection shutting down");
        shuttingDown = true;
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    private void release(String bucketId, String leaseId) {
        try {
            if (!leaseRepository.release(bucketId, leaseId)) {
                logger.error("Lease on bucket {} expired before the drain finished", bucketId);
                meterRegistry.counter("activity_lease_expired_total").increment();
            }
        } catch (RuntimeException e) {
            logger.error("Failed to release lease on bucket {}, it frees up when the lease expires", bucketId, e);
        }
    }

    private BucketCollectionResult record(StreamType streamType, BucketCollectionResult result) {
        meterRegistry.counter("activity_collection_total",
                "stream", streamType.name(), "status", result.name().toLowerCase()).increment();
        return result;
    }
}
