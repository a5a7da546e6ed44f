package com.bbthechange.activityfeed.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable membership index of one aggregate, stored under its group key and written with
 * compare-and-swap on {@code version}. A version of 0 means the state has never been stored.
 */
public class AggregateState {

    private final String groupKey;
    private final String ruleId;
    private final String verb;
    private final Set<String> memberActorIds;
    private final Set<String> memberObjectIds;
    private final Set<String> memberTargetIds;
    private AggregateStatus status;
    private Instant createdAt;
    private Instant lastUpdatedAt;
    private Instant expiresAt;
    private long version;

    public AggregateState(String groupKey, String ruleId, String verb) {
        this.groupKey = groupKey;
        this.ruleId = ruleId;
        this.verb = verb;
        this.memberActorIds = new LinkedHashSet<>();
        this.memberObjectIds = new LinkedHashSet<>();
        this.memberTargetIds = new LinkedHashSet<>();
        this.status = AggregateStatus.orphaned(Set.of());
        this.version = 0L;
    }

    public AggregateState(AggregateState other) {
        this(other.groupKey, other.ruleId, other.verb);
        this.memberActorIds.addAll(other.memberActorIds);
        this.memberObjectIds.addAll(other.memberObjectIds);
        this.memberTargetIds.addAll(other.memberTargetIds);
        this.status = other.status;
        this.createdAt = other.createdAt;
        this.lastUpdatedAt = other.lastUpdatedAt;
        this.expiresAt = other.expiresAt;
        this.version = other.version;
    }

    /**
     * Fold an event into the member sets. Set union, so merging the same event twice is a no-op.
     */
    public void merge(RawEvent event) {
        add(memberActorIds, event.actorId());
        add(memberObjectIds, event.objectId());
        add(memberTargetIds, event.targetId());
        if (createdAt == null) {
            createdAt = event.timestamp();
        }
        if (lastUpdatedAt == null || event.timestamp().isAfter(lastUpdatedAt)) {
            lastUpdatedAt = event.timestamp();
        }
    }

    public boolean contains(RawEvent event) {
        return containsOrAbsent(memberActorIds, event.actorId())
                && containsOrAbsent(memberObjectIds, event.objectId())
                && containsOrAbsent(memberTargetIds, event.targetId());
    }

    /**
     * True when every member of {@code activity} is also a member of this aggregate.
     */
    public boolean covers(Activity activity) {
        return memberActorIds.containsAll(activity.getActorIds())
                && memberObjectIds.containsAll(activity.getObjectIds())
                && memberTargetIds.containsAll(activity.getTargetIds());
    }

    /**
     * An aggregate is non-trivial once it has folded more than one entity into some slot.
     */
    public boolean isNonTrivial() {
        return memberActorIds.size() > 1 || memberObjectIds.size() > 1 || memberTargetIds.size() > 1;
    }

    /**
     * Drop members whose pairs another live activity already shows.
     */
    public void removeMembers(Collection<String> actorIds, Collection<String> objectIds) {
        memberActorIds.removeAll(actorIds);
        memberObjectIds.removeAll(objectIds);
    }

    public boolean hasActorsAndObjects() {
        return !memberActorIds.isEmpty() && !memberObjectIds.isEmpty();
    }

    private static void add(Set<String> members, String id) {
        if (id != null) {
            members.add(id);
        }
    }

    private static boolean containsOrAbsent(Set<String> members, String id) {
        return id == null || members.contains(id);
    }

    public String getGroupKey() {
        return groupKey;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getVerb() {
        return verb;
    }

    public Set<String> getMemberActorIds() {
        return Collections.unmodifiableSet(memberActorIds);
    }

    public Set<String> getMemberObjectIds() {
        return Collections.unmodifiableSet(memberObjectIds);
    }

    public Set<String> getMemberTargetIds() {
        return Collections.unmodifiableSet(memberTargetIds);
    }

    public void addMembers(Set<String> actorIds, Set<String> objectIds, Set<String> targetIds) {
        memberActorIds.addAll(actorIds);
        memberObjectIds.addAll(objectIds);
        memberTargetIds.addAll(targetIds);
    }

    public AggregateStatus getStatus() {
        return status;
    }

    public void setStatus(AggregateStatus status) {
        this.status = status;
    }

    public String getLastActivityId() {
        return status.lastActivityId();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastUpdatedAt() {
        return lastUpdatedAt;
    }

    public void setLastUpdatedAt(Instant lastUpdatedAt) {
        this.lastUpdatedAt = lastUpdatedAt;
    }

    /**
     * When the store may reclaim this aggregate. No event can reach it after its window closes.
     */
    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    @Override
    public String toString() {
        return "AggregateState{groupKey=" + groupKey + ", ruleId=" + ruleId + ", status=" + status
                + ", version=" + version + "}";
    }
}
