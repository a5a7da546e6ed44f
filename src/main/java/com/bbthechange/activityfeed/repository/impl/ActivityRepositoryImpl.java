package com.bbthechange.activityfeed.repository.impl;

import com.bbthechange.activityfeed.exception.TransientStoreException;
import com.bbthechange.activityfeed.model.Activity;
import com.bbthechange.activityfeed.repository.ActivityRepository;
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
import software.amazon.awssdk.enhanced.dynamodb.model.GetItemEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.Optional;

/**
 * DynamoDB implementation of ActivityRepository.
 * Uses Enhanced Client with QueryPerformanceTracker for monitoring.
 */
@Repository
public class ActivityRepositoryImpl implements ActivityRepository {

    private static final Logger logger = LoggerFactory.getLogger(ActivityRepositoryImpl.class);
    private static final String TABLE_NAME = ActivityKeyFactory.TABLE_NAME;

    private final DynamoDbTable<Activity> activityTable;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public ActivityRepositoryImpl(DynamoDbEnhancedClient enhancedClient,
                                  QueryPerformanceTracker performanceTracker) {
        this.activityTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(Activity.class));
        this.performanceTracker = performanceTracker;
    }

    @Override
    public Activity save(Activity activity) {
        return performanceTracker.trackQuery("saveActivity", TABLE_NAME, () -> {
            try {
                activity.touch();
                activityTable.putItem(activity);
                logger.debug("Saved activity {}", activity.getActivityId());
                return activity;
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to save activity " + activity.getActivityId(), e);
            }
        });
    }

    @Override
    public Optional<Activity> findById(String activityId) {
        return performanceTracker.trackQuery("findActivityById", TABLE_NAME, () -> {
            try {
                Activity activity = activityTable.getItem(GetItemEnhancedRequest.builder()
                        .key(key(activityId))
                        .consistentRead(true)
                        .build());
                return Optional.ofNullable(activity);
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to read activity " + activityId, e);
            }
        });
    }

    @Override
    public void delete(String activityId) {
        performanceTracker.track("deleteActivity", TABLE_NAME, () -> {
            try {
                activityTable.deleteItem(key(activityId));
                logger.debug("Deleted activity {}", activityId);
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to delete activity " + activityId, e);
            }
        });
    }

    private static Key key(String activityId) {
        return Key.builder()
                .partitionValue(ActivityKeyFactory.getActivityPk(activityId))
                .sortValue(ActivityKeyFactory.getMetadataSk())
                .build();
    }
}
