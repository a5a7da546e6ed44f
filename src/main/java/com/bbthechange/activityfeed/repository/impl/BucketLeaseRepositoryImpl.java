package com.bbthechange.activityfeed.repository.impl;

import com.bbthechange.activityfeed.exception.TransientStoreException;
import com.bbthechange.activityfeed.repository.BucketLeaseRepository;
import com.bbthechange.activityfeed.util.ActivityKeyFactory;
import com.bbthechange.activityfeed.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * DynamoDB implementation of BucketLeaseRepository.
 *
 * A lease is a single item per bucket. Acquiring is a conditional put that only succeeds when no
 * lease exists or the existing one has expired; releasing is a conditional delete on the lease id.
 */
@Repository
public class BucketLeaseRepositoryImpl implements BucketLeaseRepository {

    private static final Logger logger = LoggerFactory.getLogger(BucketLeaseRepositoryImpl.class);
    private static final String TABLE_NAME = ActivityKeyFactory.TABLE_NAME;

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker performanceTracker;
    private final Clock clock;

    @Autowired
    public BucketLeaseRepositoryImpl(DynamoDbClient dynamoDbClient,
                                     QueryPerformanceTracker performanceTracker,
                                     Clock clock) {
        this.dynamoDbClient = dynamoDbClient;
        this.performanceTracker = performanceTracker;
        this.clock = clock;
    }

    @Override
    public Optional<String> tryAcquire(String bucketId, Duration leaseDuration) {
        Instant now = clock.instant();
        Instant leaseExpiresAt = now.plus(leaseDuration);
        String leaseId = UUID.randomUUID().toString();

        Map<String, AttributeValue> item = new HashMap<>(key(bucketId));
        item.put("itemType", AttributeValue.builder().s(ActivityKeyFactory.LEASE_PREFIX).build());
        item.put("bucketId", AttributeValue.builder().s(bucketId).build());
        item.put("leaseId", AttributeValue.builder().s(leaseId).build());
        item.put("leaseExpiresAt", number(leaseExpiresAt.toEpochMilli()));
        // Let TTL sweep abandoned leases well after they stop mattering
        item.put("expiresAt", number(leaseExpiresAt.plus(Duration.ofDays(1)).getEpochSecond()));

        PutItemRequest request = PutItemRequest.builder()
                .tableName(TABLE_NAME)
                .item(item)
                .conditionExpression("attribute_not_exists(pk) OR leaseExpiresAt < :now")
                .expressionAttributeValues(Map.of(":now", number(now.toEpochMilli())))
                .build();

        return performanceTracker.trackQuery("acquireBucketLease", TABLE_NAME, () -> {
            try {
                dynamoDbClient.putItem(request);
                logger.debug("Acquired lease {} on bucket {} until {}", leaseId, bucketId, leaseExpiresAt);
                return Optional.of(leaseId);
            } catch (ConditionalCheckFailedException e) {
                logger.debug("Bucket {} is leased by another collector", bucketId);
                return Optional.empty();
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to acquire lease on bucket " + bucketId, e);
            }
        });
    }

    @Override
    public boolean release(String bucketId, String leaseId) {
        Instant now = clock.instant();
        DeleteItemRequest request = DeleteItemRequest.builder()
                .tableName(TABLE_NAME)
                .key(key(bucketId))
                .conditionExpression("leaseId = :leaseId")
                .expressionAttributeValues(Map.of(":leaseId", AttributeValue.builder().s(leaseId).build()))
                .returnValues(ReturnValue.ALL_OLD)
                .build();

        return performanceTracker.trackQuery("releaseBucketLease", TABLE_NAME, () -> {
            try {
                DeleteItemResponse response = dynamoDbClient.deleteItem(request);
                AttributeValue expiresAt = response.hasAttributes() ? response.attributes().get("leaseExpiresAt") : null;
                // Still ours by id, but only counts as held if it had not run out
                return expiresAt != null && Long.parseLong(expiresAt.n()) >= now.toEpochMilli();
            } catch (ConditionalCheckFailedException e) {
                return false;
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to release lease on bucket " + bucketId, e);
            }
        });
    }

    private static Map<String, AttributeValue> key(String bucketId) {
        return Map.of(
                "pk", AttributeValue.builder().s(ActivityKeyFactory.getLeasePk(bucketId)).build(),
                "sk", AttributeValue.builder().s(ActivityKeyFactory.getMetadataSk()).build());
    }

    private static AttributeValue number(long value) {
        return AttributeValue.builder().n(String.valueOf(value)).build();
    }
}
