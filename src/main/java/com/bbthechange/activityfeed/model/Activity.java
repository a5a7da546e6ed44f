package com.bbthechange.activityfeed.model;

import com.bbthechange.activityfeed.util.ActivityKeyFactory;
import com.bbthechange.activityfeed.util.InstantAsLongAttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A materialized, deliverable activity. Activities are never updated: a replacement is a new
 * activity with a higher revision, and the old one is deleted once the owning aggregate points
 * at the new one.
 *
 * Key pattern: PK = ACTIVITY#{activityId}, SK = METADATA
 */
@DynamoDbBean
public class Activity extends BaseItem {

    private String activityId;
    private String verb;
    private List<String> actorIds;
    private List<String> objectIds;
    private List<String> targetIds;
    private Instant publishedAt;
    private String sourceGroupKey;
    private Integer revision;

    // Default constructor for DynamoDB
    public Activity() {
        super();
        setItemType(ActivityKeyFactory.ACTIVITY_PREFIX);
        this.actorIds = new ArrayList<>();
        this.objectIds = new ArrayList<>();
        this.targetIds = new ArrayList<>();
    }

    public Activity(String activityId, String verb, Collection<String> actorIds, Collection<String> objectIds,
                    Collection<String> targetIds, Instant publishedAt, String sourceGroupKey, int revision) {
        this();
        this.activityId = activityId;
        this.verb = verb;
        this.actorIds = new ArrayList<>(actorIds);
        this.objectIds = new ArrayList<>(objectIds);
        this.targetIds = new ArrayList<>(targetIds);
        this.publishedAt = publishedAt;
        this.sourceGroupKey = sourceGroupKey;
        this.revision = revision;
        setPk(ActivityKeyFactory.getActivityPk(activityId));
        setSk(ActivityKeyFactory.getMetadataSk());
    }

    /**
     * Every principal referenced by this activity, in actor, object, target order.
     */
    public Set<String> entityIds() {
        Set<String> ids = new LinkedHashSet<>(actorIds);
        ids.addAll(objectIds);
        ids.addAll(targetIds);
        return ids;
    }

    public List<String> idsFor(PivotField field) {
        return switch (field) {
            case ACTOR -> actorIds;
            case OBJECT -> objectIds;
            case TARGET -> targetIds;
        };
    }

    public String getActivityId() {
        return activityId;
    }

    public void setActivityId(String activityId) {
        this.activityId = activityId;
    }

    public String getVerb() {
        return verb;
    }

    public void setVerb(String verb) {
        this.verb = verb;
    }

    public List<String> getActorIds() {
        return actorIds;
    }

    public void setActorIds(List<String> actorIds) {
        this.actorIds = actorIds == null ? new ArrayList<>() : actorIds;
    }

    public List<String> getObjectIds() {
        return objectIds;
    }

    public void setObjectIds(List<String> objectIds) {
        this.objectIds = objectIds == null ? new ArrayList<>() : objectIds;
    }

    public List<String> getTargetIds() {
        return targetIds;
    }

    public void setTargetIds(List<String> targetIds) {
        this.targetIds = targetIds == null ? new ArrayList<>() : targetIds;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getPublishedAt() {
        return publishedAt;
    }

    public void setPublishedAt(Instant publishedAt) {
        this.publishedAt = publishedAt;
    }

    public String getSourceGroupKey() {
        return sourceGroupKey;
    }

    public void setSourceGroupKey(String sourceGroupKey) {
        this.sourceGroupKey = sourceGroupKey;
    }

    public Integer getRevision() {
        return revision;
    }

    public void setRevision(Integer revision) {
        this.revision = revision;
    }

    @Override
    public String toString() {
        return "Activity{activityId=" + activityId + ", verb=" + verb + ", actors=" + actorIds
                + ", objects=" + objectIds + ", targets=" + targetIds + ", revision=" + revision + "}";
    }
}
