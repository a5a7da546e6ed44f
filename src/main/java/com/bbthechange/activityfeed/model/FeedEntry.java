package com.bbthechange.activityfeed.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.time.Instant;
import java.util.List;

/**
 * A materialized entry in a recipient's activity or notification stream.
 *
 * Key pattern: PK = FEED#{recipientId}#{streamType}, SK = ACTIVITY#{activityId}
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = false)
@DynamoDbBean
public class FeedEntry extends BaseItem {
    private String recipientId;
    private StreamType streamType;
    private String activityId;
    private String verb;
    private List<String> actorIds;
    private List<String> objectIds;
    private List<String> targetIds;
    private Integer revision;
    private Instant publishedAt;
}
