package com.bbthechange.activityfeed.repository;

import com.bbthechange.activityfeed.model.DeliveryRecord;

import java.util.List;

/**
 * Repository interface for pending deliveries, partitioned by bucket.
 */
public interface DeliveryRecordRepository {

    /**
     * Insert or overwrite a delivery keyed by bucket, recipient and activity.
     * @param record The delivery record
     */
    void upsert(DeliveryRecord record);

    /**
     * Read up to {@code limit} pending records from a bucket.
     * @param bucketId The bucket ID
     * @param limit Maximum number of records
     * @return Records in key order
     */
    List<DeliveryRecord> findByBucket(String bucketId, int limit);

    /**
     * Read the pending records of one recipient in a bucket.
     * @param bucketId The bucket ID
     * @param recipientId The recipient ID
     * @return The recipient's records
     */
    List<DeliveryRecord> findByBucketAndRecipient(String bucketId, String recipientId);

    /**
     * Remove a drained record.
     * @param record The record to delete
     */
    void delete(DeliveryRecord record);
}
