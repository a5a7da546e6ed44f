package com.bbthechange.activityfeed.service;

import com.bbthechange.activityfeed.model.BucketCollectionResult;

import java.time.Instant;
import java.util.Map;

/**
 * Drains email buckets into one digest per recipient.
 */
public interface EmailCollector {

    /**
     * Collect the immediate buckets and whichever daily or weekly buckets are due at {@code now}.
     */
    Map<String, BucketCollectionResult> collectAllBuckets(Instant now);

    BucketCollectionResult collectBucket(String bucketId);

    void shutdown();
}
