package com.bbthechange.activityfeed.repository.impl;

import com.bbthechange.activityfeed.exception.ConflictException;
import com.bbthechange.activityfeed.exception.TransientStoreException;
import com.bbthechange.activityfeed.model.AggregateState;
import com.bbthechange.activityfeed.model.AggregateStatus;
import com.bbthechange.activityfeed.repository.AggregateStateRepository;
import com.bbthechange.activityfeed.util.ActivityKeyFactory;
import com.bbthechange.activityfeed.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * DynamoDB implementation of AggregateStateRepository.
 *
 * Uses the low-level client so the version check is part of the write itself:
 * {@code attribute_not_exists(pk)} for a first write, {@code #ver = :expectedVersion} afterwards.
 * Member sets are stored as string sets; DynamoDB does not allow empty sets, so empty ones are omitted.
 */
@Repository
public class AggregateStateRepositoryImpl implements AggregateStateRepository {

    private static final Logger logger = LoggerFactory.getLogger(AggregateStateRepositoryImpl.class);
    private static final String TABLE_NAME = ActivityKeyFactory.TABLE_NAME;

    static final String STATUS_ACTIVE = "ACTIVE";
    static final String STATUS_ORPHANED = "ORPHANED";

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public AggregateStateRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.performanceTracker = performanceTracker;
    }

    @Override
    public Optional<AggregateState> find(String groupKey) {
        return performanceTracker.trackQuery("findAggregateState", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                        .tableName(TABLE_NAME)
                        .key(key(groupKey))
                        .consistentRead(true)
                        .build());
                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(fromItem(response.item()));
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to read aggregate " + groupKey, e);
            }
        });
    }

    @Override
    public AggregateState put(AggregateState state) {
        long expectedVersion = state.getVersion();
        long newVersion = expectedVersion + 1;

        PutItemRequest.Builder request = PutItemRequest.builder()
                .tableName(TABLE_NAME)
                .item(toItem(state, newVersion));
        if (expectedVersion == 0L) {
            request.conditionExpression("attribute_not_exists(pk)");
        } else {
            request.conditionExpression("#ver = :expectedVersion")
                    .expressionAttributeNames(Map.of("#ver", "version"))
                    .expressionAttributeValues(Map.of(":expectedVersion", number(expectedVersion)));
        }

        boolean written = performanceTracker.trackQuery("putAggregateState", TABLE_NAME, () -> {
            try {
                dynamoDbClient.putItem(request.build());
                return true;
            } catch (ConditionalCheckFailedException e) {
                return false;
            } catch (DynamoDbException e) {
                throw new TransientStoreException("Failed to write aggregate " + state.getGroupKey(), e);
            }
        });

        if (!written) {
            logger.debug("Version conflict on aggregate {} (expected version {})", state.getGroupKey(), expectedVersion);
            throw new ConflictException(state.getGroupKey(), expectedVersion, null);
        }

        AggregateState stored = new AggregateState(state);
        stored.setVersion(newVersion);
        return stored;
    }

    private static Map<String, AttributeValue> key(String groupKey) {
        return Map.of(
                "pk", AttributeValue.builder().s(ActivityKeyFactory.getAggregatePk(groupKey)).build(),
                "sk", AttributeValue.builder().s(ActivityKeyFactory.getMetadataSk()).build());
    }

    Map<String, AttributeValue> toItem(AggregateState state, long version) {
        Map<String, AttributeValue> item = new HashMap<>(key(state.getGroupKey()));
        item.put("itemType", AttributeValue.builder().s(ActivityKeyFactory.AGGREGATE_PREFIX).build());
        item.put("groupKey", AttributeValue.builder().s(state.getGroupKey()).build());
        item.put("ruleId", AttributeValue.builder().s(state.getRuleId()).build());
        item.put("verb", AttributeValue.builder().s(state.getVerb()).build());
        // Lists, not string sets: member order is the order the activity shows them in
        putStringList(item, "actorIds", state.getMemberActorIds());
        putStringList(item, "objectIds", state.getMemberObjectIds());
        putStringList(item, "targetIds", state.getMemberTargetIds());

        AggregateStatus status = state.getStatus();
        status.match(
                active -> {
                    item.put("status", AttributeValue.builder().s(STATUS_ACTIVE).build());
                    item.put("activityId", AttributeValue.builder().s(active.activityId()).build());
                    return null;
                },
                orphaned -> {
                    item.put("status", AttributeValue.builder().s(STATUS_ORPHANED).build());
                    putStringSet(item, "supersededBy", orphaned.supersededBy());
                    return null;
                });

        putInstant(item, "createdAt", state.getCreatedAt());
        putInstant(item, "lastUpdatedAt", state.getLastUpdatedAt());
        if (state.getExpiresAt() != null) {
            // TTL attribute is epoch seconds
            item.put("expiresAt", number(state.getExpiresAt().getEpochSecond()));
        }
        item.put("version", number(version));
        return item;
    }

    AggregateState fromItem(Map<String, AttributeValue> item) {
        AggregateState state = new AggregateState(
                item.get("groupKey").s(), item.get("ruleId").s(), item.get("verb").s());
        state.addMembers(stringList(item, "actorIds"), stringList(item, "objectIds"), stringList(item, "targetIds"));

        if (STATUS_ACTIVE.equals(item.get("status").s())) {
            state.setStatus(AggregateStatus.active(item.get("activityId").s()));
        } else {
            state.setStatus(AggregateStatus.orphaned(stringSet(item, "supersededBy")));
        }

        state.setCreatedAt(instant(item, "createdAt"));
        state.setLastUpdatedAt(instant(item, "lastUpdatedAt"));
        if (item.containsKey("expiresAt")) {
            state.setExpiresAt(Instant.ofEpochSecond(Long.parseLong(item.get("expiresAt").n())));
        }
        state.setVersion(Long.parseLong(item.get("version").n()));
        return state;
    }

    private static void putStringSet(Map<String, AttributeValue> item, String name, Collection<String> values) {
        if (!values.isEmpty()) {
            item.put(name, AttributeValue.builder().ss(values).build());
        }
    }

    private static void putStringList(Map<String, AttributeValue> item, String name, Collection<String> values) {
        if (!values.isEmpty()) {
            List<AttributeValue> elements = values.stream()
                    .map(value -> AttributeValue.builder().s(value).build())
                    .collect(Collectors.toList());
            item.put(name, AttributeValue.builder().l(elements).build());
        }
    }

    private static Set<String> stringList(Map<String, AttributeValue> item, String name) {
        AttributeValue value = item.get(name);
        if (value == null || !value.hasL()) {
            return Set.of();
        }
        Set<String> members = new LinkedHashSet<>();
        value.l().forEach(element -> members.add(element.s()));
        return members;
    }

    private static Set<String> stringSet(Map<String, AttributeValue> item, String name) {
        AttributeValue value = item.get(name);
        if (value == null || !value.hasSs()) {
            return Set.of();
        }
        return new LinkedHashSet<>(value.ss());
    }

    private static void putInstant(Map<String, AttributeValue> item, String name, Instant value) {
        if (value != null) {
            item.put(name, number(value.toEpochMilli()));
        }
    }

    private static Instant instant(Map<String, AttributeValue> item, String name) {
        AttributeValue value = item.get(name);
        return value == null ? null : Instant.ofEpochMilli(Long.parseLong(value.n()));
    }

    private static AttributeValue number(long value) {
        return AttributeValue.builder().n(String.valueOf(value)).build();
    }
}
