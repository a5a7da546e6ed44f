package com.bbthechange.activityfeed.repository;

import java.time.Duration;
import java.util.Optional;

/**
 * Repository interface for bucket collection leases. A lease gives one collector exclusive
 * rights to drain a bucket until it is released or expires.
 */
public interface BucketLeaseRepository {

    /**
     * Try to take the lease on a bucket.
     * @param bucketId The bucket ID
     * @param leaseDuration How long the lease is valid if not released
     * @return The lease ID if acquired, empty if another collector holds a live lease
     */
    Optional<String> tryAcquire(String bucketId, Duration leaseDuration);

    /**
     * Give a lease back.
     * @param bucketId The bucket ID
     * @param leaseId The lease ID returned by {@link #tryAcquire}
     * @return true if the lease was still held by the caller, false if it had expired or been taken over
     */
    boolean release(String bucketId, String leaseId);
}
