package com.bbthechange.activityfeed.model;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Strategy for folding events of one verb together. Fields listed in {@code pivotFields}
 * must be equal for two events to share an aggregate; the other fields accumulate.
 */
public record GroupingRule(String ruleId, String verb, Set<PivotField> pivotFields, Duration mergeWindow) {

    public GroupingRule {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("Grouping rule id is required");
        }
        if (mergeWindow == null || mergeWindow.isNegative() || mergeWindow.toMillis() < 1) {
            throw new IllegalArgumentException("Grouping rule " + ruleId + " needs a merge window of at least 1ms");
        }
        pivotFields = pivotFields.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(pivotFields));
    }

    public boolean pivotsOn(PivotField field) {
        return pivotFields.contains(field);
    }

    /**
     * Rule used for verbs that have no configured grouping: every field is pivoted, so events
     * never fold together but exact repeats inside the window are still recognised.
     */
    public static GroupingRule implicitFor(String verb, Duration mergeWindow) {
        return new GroupingRule(verb + ":exact", verb, EnumSet.allOf(PivotField.class), mergeWindow);
    }
}
