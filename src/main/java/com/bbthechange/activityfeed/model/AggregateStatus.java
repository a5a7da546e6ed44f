package com.bbthechange.activityfeed.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;

/**
 * Ownership state of an aggregate. An aggregate is either backing exactly one live activity,
 * or it has been orphaned and its members are represented by the aggregates named in
 * {@link Orphaned#supersededBy()}.
 */
public interface AggregateStatus {

    <R> R match(Function<Active, R> whenActive, Function<Orphaned, R> whenOrphaned);

    default boolean isActive() {
        return match(active -> true, orphaned -> false);
    }

    /**
     * The live activity owned by this aggregate, or null when orphaned.
     */
    default String lastActivityId() {
        return match(Active::activityId, orphaned -> null);
    }

    default Set<String> supersededBy() {
        return match(active -> Set.of(), Orphaned::supersededBy);
    }

    static AggregateStatus active(String activityId) {
        return new Active(activityId);
    }

    static AggregateStatus orphaned(Collection<String> supersededBy) {
        return new Orphaned(new LinkedHashSet<>(supersededBy));
    }

    record Active(String activityId) implements AggregateStatus {

        public Active {
            if (activityId == null || activityId.isBlank()) {
                throw new IllegalArgumentException("Active aggregate requires an activity id");
            }
        }

        @Override
        public <R> R match(Function<Active, R> whenActive, Function<Orphaned, R> whenOrphaned) {
            return whenActive.apply(this);
        }
    }

    record Orphaned(Set<String> supersededBy) implements AggregateStatus {

        public Orphaned {
            supersededBy = Set.copyOf(supersededBy);
        }

        @Override
        public <R> R match(Function<Active, R> whenActive, Function<Orphaned, R> whenOrphaned) {
            return whenOrphaned.apply(this);
        }

        /**
         * Copy of this status that also names {@code groupKey} as superseding aggregate.
         */
        public Orphaned withSupersededBy(String groupKey) {
            Set<String> keys = new LinkedHashSet<>(supersededBy);
            keys.add(groupKey);
            return new Orphaned(keys);
        }
    }
}
