package com.bbthechange.activityfeed.repository.impl;

import com.bbthechange.activityfeed.exception.TransientStoreException;
import com.bbthechange.activityfeed.model.FeedEntry;
import com.bbthechange.activityfeed.model.StreamType;
import com.bbthechange.activityfeed.repository.FeedRepository;
import com.bbthechange.activityfeed.util.ActivityKeyFactory;
import com.bbthechange.activityfeed.util.QueryPerformanceTracker;
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
import java.util.Optional;

/**
 * DynamoDB implementation of FeedRepository.
 * Activity ids are time-ordered, so a reverse sort-key scan returns the newest entries first.
 */
@Repository
public class FeedRepositoryImpl implements FeedRepository {

    private static final String TABLE_NAME = ActivityKeyFactory.TABLE_NAME;

    private final DynamoDbTable<FeedEntry> feedTable;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public FeedRepositoryImpl(DynamoDbEnhancedClient enhancedClient, QueryPerformanceTracker performanceTracker) {
        this.feedTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(FeedEntry.class));
        this.performanceTracker = performanceTracker;
    }

    @Override
    public void save(FeedEntry entry) {
        performanceTracker.track("saveFeedEntry", TABLE_NAME, () -> {
            try {
                entry.setPk(ActivityKeyFactory.getFeedPk(entry.getRecipientId(), entry.getStreamType()));
                entry.setSk(ActivityKeyFactory.getActivitySk(entry.getActivityId()));
                entry.setItemType(ActivityKeyFactory.FEED_PREFIX);
                entry.touch();
                feedTable.putItem(entry);
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to save feed entry for " + entry.getRecipientId(), e);
            }
        });
    }

    @Override
    public Optional<FeedEntry> find(String recipientId, StreamType streamType, String activityId) {
        return performanceTracker.trackQuery("findFeedEntry", TABLE_NAME, () -> {
            try {
                return Optional.ofNullable(feedTable.getItem(key(recipientId, streamType, activityId)));
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to read feed entry for " + recipientId, e);
            }
        });
    }

    @Override
    public void delete(String recipientId, StreamType streamType, String activityId) {
        performanceTracker.track("deleteFeedEntry", TABLE_NAME, () -> {
            try {
                feedTable.deleteItem(key(recipientId, streamType, activityId));
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to delete feed entry for " + recipientId, e);
            }
        });
    }

    @Override
    public List<FeedEntry> findStream(String recipientId, StreamType streamType, int limit) {
        return performanceTracker.trackQuery("findFeedStream", TABLE_NAME, () -> {
            try {
                QueryConditional conditional = QueryConditional.keyEqualTo(
                        Key.builder().partitionValue(ActivityKeyFactory.getFeedPk(recipientId, streamType)).build());
                return feedTable.query(QueryEnhancedRequest.builder()
                                .queryConditional(conditional)
                                .scanIndexForward(false)
                                .limit(limit)
                                .build())
                        .items()
                        .stream()
                        .limit(limit)
                        .toList();
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to read stream of " + recipientId, e);
            }
        });
    }

    private static Key key(String recipientId, StreamType streamType, String activityId) {
        return Key.builder()
                .partitionValue(ActivityKeyFactory.getFeedPk(recipientId, streamType))
                .sortValue(ActivityKeyFactory.getActivitySk(activityId))
                .build();
    }
}
