package com.bbthechange.activityfeed.model;

import com.bbthechange.activityfeed.util.ActivityKeyFactory;
import com.bbthechange.activityfeed.util.InstantAsLongAttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A pending delivery of one activity to one recipient's stream, parked in a bucket until the
 * collector drains it. Writing the same record twice overwrites it.
 *
 * Key pattern: PK = BUCKET#{bucketId}, SK = RECIPIENT#{recipientId}#ACTIVITY#{activityId}
 */
@DynamoDbBean
public class DeliveryRecord extends BaseItem {

    private String bucketId;
    private String recipientId;
    private StreamType streamType;
    private String activityId;
    private List<String> replacedActivityIds;
    private Instant publishedAt;

    // Default constructor for DynamoDB
    public DeliveryRecord() {
        super();
        setItemType(ActivityKeyFactory.DELIVERY_PREFIX);
        this.replacedActivityIds = new ArrayList<>();
    }

    public DeliveryRecord(String bucketId, String recipientId, StreamType streamType, String activityId,
                          List<String> replacedActivityIds, Instant publishedAt) {
        this();
        this.bucketId = bucketId;
        this.recipientId = recipientId;
        this.streamType = streamType;
        this.activityId = activityId;
        this.replacedActivityIds = new ArrayList<>(replacedActivityIds);
        this.publishedAt = publishedAt;
        setPk(ActivityKeyFactory.getBucketPk(bucketId));
        setSk(ActivityKeyFactory.getDeliverySk(recipientId, activityId));
    }

    public boolean isReplacement() {
        return !replacedActivityIds.isEmpty();
    }

    public String getBucketId() {
        return bucketId;
    }

    public void setBucketId(String bucketId) {
        this.bucketId = bucketId;
    }

    public String getRecipientId() {
        return recipientId;
    }

    public void setRecipientId(String recipientId) {
        this.recipientId = recipientId;
    }

    public StreamType getStreamType() {
        return streamType;
    }

    public void setStreamType(StreamType streamType) {
        this.streamType = streamType;
    }

    public String getActivityId() {
        return activityId;
    }

    public void setActivityId(String activityId) {
        this.activityId = activityId;
    }

    public List<String> getReplacedActivityIds() {
        return replacedActivityIds;
    }

    public void setReplacedActivityIds(List<String> replacedActivityIds) {
        this.replacedActivityIds = replacedActivityIds != null ? replacedActivityIds : new ArrayList<>();
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getPublishedAt() {
        return publishedAt;
    }

    public void setPublishedAt(Instant publishedAt) {
        this.publishedAt = publishedAt;
    }

    @Override
    public String toString() {
        return "DeliveryRecord{bucketId=" + bucketId + ", recipientId=" + recipientId + ", streamType=" + streamType
                + ", activityId=" + activityId + "}";
    }
}
