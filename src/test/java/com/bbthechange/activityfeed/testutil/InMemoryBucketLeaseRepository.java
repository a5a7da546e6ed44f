package com.bbthechange.activityfeed.testutil;

import com.bbthechange.activityfeed.repository.BucketLeaseRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public class InMemoryBucketLeaseRepository implements BucketLeaseRepository {

    private record Lease(String leaseId, Instant expiresAt) {
    }

    private final Map<String, Lease> leases = new HashMap<>();
    private final Clock clock;

    public InMemoryBucketLeaseRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<String> tryAcquire(String bucketId, Duration leaseDuration) {
        Lease current = leases.get(bucketId);
        Instant now = clock.instant();
        if (current != null && !current.expiresAt().isBefore(now)) {
            return Optional.empty();
        }
        Lease lease = new Lease(UUID.randomUUID().toString(), now.plus(leaseDuration));
        leases.put(bucketId, lease);
        return Optional.of(lease.leaseId());
    }

    @Override
    public synchronized boolean release(String bucketId, String leaseId) {
        Lease current = leases.get(bucketId);
        if (current == null || !current.leaseId().equals(leaseId)) {
            return false;
        }
        leases.remove(bucketId);
        return !current.expiresAt().isBefore(clock.instant());
    }

    public synchronized boolean isLeased(String bucketId) {
        Lease current = leases.get(bucketId);
        return current != null && !current.expiresAt().isBefore(clock.instant());
    }
}
