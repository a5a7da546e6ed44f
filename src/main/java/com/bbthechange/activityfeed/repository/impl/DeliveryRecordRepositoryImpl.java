package com.bbthechange.activityfeed.repository.impl;

import com.bbthechange.activityfeed.exception.TransientStoreException;
import com.bbthechange.activityfeed.model.DeliveryRecord;
import com.bbthechange.activityfeed.repository.DeliveryRecordRepository;
import com.bbthechange.activityfeed.util.ActivityKeyFactory;
import com.bbthechange.activityfeed.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.List;

/**
 * DynamoDB implementation of DeliveryRecordRepository.
 * All records of a bucket share one partition, so a drain is a single-partition query.
 */
@Repository
public class DeliveryRecordRepositoryImpl implements DeliveryRecordRepository {

    private static final Logger logger = LoggerFactory.getLogger(DeliveryRecordRepositoryImpl.class);
    private static final String TABLE_NAME = ActivityKeyFactory.TABLE_NAME;

    private final DynamoDbTable<DeliveryRecord> deliveryTable;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public DeliveryRecordRepositoryImpl(DynamoDbEnhancedClient enhancedClient,
                                        QueryPerformanceTracker performanceTracker) {
        this.deliveryTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(DeliveryRecord.class));
        this.performanceTracker = performanceTracker;
    }

    @Override
    public void upsert(DeliveryRecord record) {
        performanceTracker.track("upsertDeliveryRecord", TABLE_NAME, () -> {
            try {
                record.touch();
                deliveryTable.putItem(record);
                logger.debug("Queued delivery {}", record);
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to queue delivery for " + record.getRecipientId(), e);
            }
        });
    }

    @Override
    public List<DeliveryRecord> findByBucket(String bucketId, int limit) {
        return performanceTracker.trackQuery("findDeliveriesByBucket", TABLE_NAME, () -> {
            try {
                QueryConditional conditional = QueryConditional.keyEqualTo(
                        Key.builder().partitionValue(ActivityKeyFactory.getBucketPk(bucketId)).build());
                return deliveryTable.query(QueryEnhancedRequest.builder()
                                .queryConditional(conditional)
                                .consistentRead(true)
                                .limit(limit)
                                .build())
                        .items()
                        .stream()
                        .limit(limit)
                        .toList();
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to read bucket " + bucketId, e);
            }
        });
    }

    @Override
    public List<DeliveryRecord> findByBucketAndRecipient(String bucketId, String recipientId) {
        return performanceTracker.trackQuery("findDeliveriesByRecipient", TABLE_NAME, () -> {
            try {
                QueryConditional conditional = QueryConditional.sortBeginsWith(
                        Key.builder()
                                .partitionValue(ActivityKeyFactory.getBucketPk(bucketId))
                                .sortValue(ActivityKeyFactory.getRecipientSkPrefix(recipientId))
                                .build());
                return deliveryTable.query(QueryEnhancedRequest.builder()
                                .queryConditional(conditional)
                                .consistentRead(true)
                                .build())
                        .items()
                        .stream()
                        .toList();
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to read deliveries of " + recipientId + " in " + bucketId, e);
            }
        });
    }

    @Override
    public void delete(DeliveryRecord record) {
        performanceTracker.track("deleteDeliveryRecord", TABLE_NAME, () -> {
            try {
                deliveryTable.deleteItem(Key.builder()
                        .partitionValue(record.getPk())
                        .sortValue(record.getSk())
                        .build());
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to delete delivery " + record, e);
            }
        });
    }
}
