package com.bbthechange.activityfeed.util;

import com.bbthechange.activityfeed.model.GroupKey;
import com.bbthechange.activityfeed.model.GroupingRule;
import com.bbthechange.activityfeed.model.PivotField;
import com.bbthechange.activityfeed.model.RawEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class GroupKeysTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:10:00Z");

    private final GroupingRule byActor = new GroupingRule("follow-by-actor", "following-follow",
            EnumSet.of(PivotField.ACTOR), Duration.ofHours(3));

    private RawEvent follow(String actor, String object, Instant at) {
        return new RawEvent("following-follow", actor, object, null, at);
    }

    @Test
    void compute_SamePivotDifferentObject_SameKey() {
        // When
        GroupKey first = GroupKeys.compute(byActor, follow("simon", "branden", T0));
        GroupKey second = GroupKeys.compute(byActor, follow("simon", "bert", T0.plus(Duration.ofMinutes(30))));

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(first.ruleId()).isEqualTo("follow-by-actor");
        assertThat(first.value()).startsWith("follow-by-actor:");
    }

    @Test
    void compute_DifferentPivotValue_DifferentKey() {
        // When
        GroupKey simon = GroupKeys.compute(byActor, follow("simon", "branden", T0));
        GroupKey bert = GroupKeys.compute(byActor, follow("bert", "branden", T0));

        // Then
        assertThat(simon).isNotEqualTo(bert);
    }

    @Test
    void compute_NextMergeWindow_DifferentKey() {
        // When
        GroupKey early = GroupKeys.compute(byActor, follow("simon", "branden", T0));
        GroupKey late = GroupKeys.compute(byActor, follow("simon", "branden", T0.plus(Duration.ofHours(3))));

        // Then
        assertThat(late.timeBucket()).isEqualTo(early.timeBucket() + 1);
        assertThat(late).isNotEqualTo(early);
    }

    @Test
    void compute_DifferentRulesSameValues_DifferentKey() {
        // Given
        GroupingRule byObject = new GroupingRule("follow-by-object", "following-follow",
                EnumSet.of(PivotField.OBJECT), Duration.ofHours(3));
        RawEvent event = follow("simon", "simon", T0);

        // When/Then
        assertThat(GroupKeys.compute(byActor, event)).isNotEqualTo(GroupKeys.compute(byObject, event));
    }

    @Test
    void compute_ImplicitRule_MissingTargetStillKeyed() {
        // Given
        GroupingRule exact = GroupingRule.implicitFor("group-update", Duration.ofHours(3));
        RawEvent withoutTarget = new RawEvent("group-update", "simon", "group-1", null, T0);
        RawEvent withTarget = new RawEvent("group-update", "simon", "group-1", "page-2", T0);

        // When/Then
        assertThat(GroupKeys.compute(exact, withoutTarget))
                .isEqualTo(GroupKeys.compute(exact, withoutTarget))
                .isNotEqualTo(GroupKeys.compute(exact, withTarget));
    }
}
