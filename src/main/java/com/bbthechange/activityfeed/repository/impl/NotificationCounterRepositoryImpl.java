package com.bbthechange.activityfeed.repository.impl;

import com.bbthechange.activityfeed.exception.TransientStoreException;
import com.bbthechange.activityfeed.repository.NotificationCounterRepository;
import com.bbthechange.activityfeed.util.ActivityKeyFactory;
import com.bbthechange.activityfeed.util.QueryPerformanceTracker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

import java.time.Instant;
import java.util.Map;

/**
 * DynamoDB implementation of NotificationCounterRepository using atomic ADD updates.
 */
@Repository
public class NotificationCounterRepositoryImpl implements NotificationCounterRepository {

    private static final String TABLE_NAME = ActivityKeyFactory.TABLE_NAME;

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public NotificationCounterRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.performanceTracker = performanceTracker;
    }

    @Override
    public long increment(String userId, long delta) {
        UpdateItemRequest request = UpdateItemRequest.builder()
                .tableName(TABLE_NAME)
                .key(key(userId))
                .updateExpression("ADD unreadCount :delta SET itemType = :itemType, updatedAt = :now")
                .expressionAttributeValues(Map.of(
                        ":delta", number(delta),
                        ":itemType", AttributeValue.builder().s(ActivityKeyFactory.NOTIFICATION_COUNTER_SUFFIX).build(),
                        ":now", number(System.currentTimeMillis())))
                .returnValues(ReturnValue.UPDATED_NEW)
                .build();

        return performanceTracker.trackQuery("incrementNotificationCount", TABLE_NAME, () -> {
            try {
                UpdateItemResponse response = dynamoDbClient.updateItem(request);
                return Long.parseLong(response.attributes().get("unreadCount").n());
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to increment notifications of " + userId, e);
            }
        });
    }

    @Override
    public void markRead(String userId, Instant readAt) {
        UpdateItemRequest request = UpdateItemRequest.builder()
                .tableName(TABLE_NAME)
                .key(key(userId))
                .updateExpression("SET unreadCount = :zero, lastReadAt = :readAt, itemType = :itemType, updatedAt = :readAt")
                .expressionAttributeValues(Map.of(
                        ":zero", number(0),
                        ":readAt", number(readAt.toEpochMilli()),
                        ":itemType", AttributeValue.builder().s(ActivityKeyFactory.NOTIFICATION_COUNTER_SUFFIX).build()))
                .build();

        performanceTracker.track("markNotificationsRead", TABLE_NAME, () -> {
            try {
                dynamoDbClient.updateItem(request);
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to mark notifications read for " + userId, e);
            }
        });
    }

    @Override
    public long getUnreadCount(String userId) {
        return performanceTracker.trackQuery("getNotificationCount", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                        .tableName(TABLE_NAME)
                        .key(key(userId))
                        .build());
                if (!response.hasItem() || !response.item().containsKey("unreadCount")) {
                    return 0L;
                }
                return Long.parseLong(response.item().get("unreadCount").n());
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to read notifications of " + userId, e);
            }
        });
    }

    private static Map<String, AttributeValue> key(String userId) {
        return Map.of(
                "pk", AttributeValue.builder().s(ActivityKeyFactory.getUserPk(userId)).build(),
                "sk", AttributeValue.builder().s(ActivityKeyFactory.getNotificationCounterSk()).build());
    }

    private static AttributeValue number(long value) {
        return AttributeValue.builder().n(String.valueOf(value)).build();
    }
}
