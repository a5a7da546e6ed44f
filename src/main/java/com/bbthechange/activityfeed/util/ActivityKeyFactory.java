package com.bbthechange.activityfeed.util;

import com.bbthechange.activityfeed.exception.InvalidKeyException;
import com.bbthechange.activityfeed.model.StreamType;

/**
 * Key factory for the ActivityTable single-table layout.
 * Ids are validated so that no component can smuggle in the key delimiter.
 */
public final class ActivityKeyFactory {
    private static final String DELIMITER = "#";

    public static final String TABLE_NAME = "ActivityTable";

    public static final String ACTIVITY_PREFIX = "ACTIVITY";
    public static final String AGGREGATE_PREFIX = "AGGREGATE";
    public static final String BUCKET_PREFIX = "BUCKET";
    public static final String DELIVERY_PREFIX = "DELIVERY";
    public static final String LEASE_PREFIX = "LEASE";
    public static final String FEED_PREFIX = "FEED";
    public static final String RECIPIENT_PREFIX = "RECIPIENT";
    public static final String USER_PREFIX = "USER";
    public static final String METADATA_SUFFIX = "METADATA";
    public static final String NOTIFICATION_COUNTER_SUFFIX = "NOTIFICATION_COUNTER";

    private ActivityKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static void validateId(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidKeyException(type + " ID cannot be null or empty");
        }
        if (id.contains(DELIMITER)) {
            throw new InvalidKeyException("Invalid " + type + " ID format: " + id);
        }
    }

    public static String getMetadataSk() {
        return METADATA_SUFFIX;
    }

    // Activity keys
    public static String getActivityPk(String activityId) {
        validateId(activityId, "Activity");
        return ACTIVITY_PREFIX + DELIMITER + activityId;
    }

    public static String getActivitySk(String activityId) {
        validateId(activityId, "Activity");
        return ACTIVITY_PREFIX + DELIMITER + activityId;
    }

    // Aggregate state keys
    public static String getAggregatePk(String groupKey) {
        validateId(groupKey, "Group key");
        return AGGREGATE_PREFIX + DELIMITER + groupKey;
    }

    // Bucket keys
    public static String getBucketPk(String bucketId) {
        validateId(bucketId, "Bucket");
        return BUCKET_PREFIX + DELIMITER + bucketId;
    }

    public static String getDeliverySk(String recipientId, String activityId) {
        validateId(recipientId, "Recipient");
        validateId(activityId, "Activity");
        return String.join(DELIMITER, RECIPIENT_PREFIX, recipientId, ACTIVITY_PREFIX, activityId);
    }

    public static String getRecipientSkPrefix(String recipientId) {
        validateId(recipientId, "Recipient");
        return RECIPIENT_PREFIX + DELIMITER + recipientId + DELIMITER;
    }

    public static String getLeasePk(String bucketId) {
        validateId(bucketId, "Bucket");
        return LEASE_PREFIX + DELIMITER + bucketId;
    }

    // Feed keys
    public static String getFeedPk(String recipientId, StreamType streamType) {
        validateId(recipientId, "Recipient");
        return String.join(DELIMITER, FEED_PREFIX, recipientId, streamType.name());
    }

    // Notification counter keys
    public static String getUserPk(String userId) {
        validateId(userId, "User");
        return USER_PREFIX + DELIMITER + userId;
    }

    public static String getNotificationCounterSk() {
        return NOTIFICATION_COUNTER_SUFFIX;
    }
}
