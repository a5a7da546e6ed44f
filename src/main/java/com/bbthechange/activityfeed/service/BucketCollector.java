package com.bbthechange.activityfeed.service;

import com.bbthechange.activityfeed.model.BucketCollectionResult;
import com.bbthechange.activityfeed.model.StreamType;

import java.util.Map;

/**
 * Drains activity and notification buckets into their sinks under a per-bucket lease.
 */
public interface BucketCollector {

    BucketCollectionResult collectBucket(StreamType streamType, int bucketNumber);

    /**
     * Collect every bucket of a stream once. Returns an empty map when this process is already
     * running the maximum number of concurrent collections for the stream.
     */
    Map<String, BucketCollectionResult> collectAllBuckets(StreamType streamType);

    /**
     * Stop starting new batches. Collections in progress finish their current batch.
     */
    void shutdown();
}
