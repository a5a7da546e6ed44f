package com.bbthechange.activityfeed.util;

import com.bbthechange.activityfeed.model.GroupKey;
import com.bbthechange.activityfeed.model.GroupingRule;
import com.bbthechange.activityfeed.model.PivotField;
import com.bbthechange.activityfeed.model.RawEvent;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives aggregate identities. Two events land in the same aggregate exactly when they share
 * the rule, the values of every pivoted field, and the merge-window time bucket.
 */
public final class GroupKeys {

    /** Stand-in for a pivoted entity the event does not have. */
    public static final String NULL_ENTITY = "__null__";

    private static final String SEPARATOR = "|";

    private GroupKeys() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static GroupKey compute(GroupingRule rule, RawEvent event) {
        long timeBucket = Math.floorDiv(event.timestamp().toEpochMilli(), rule.mergeWindow().toMillis());

        StringBuilder material = new StringBuilder(rule.ruleId());
        for (PivotField field : PivotField.values()) {
            material.append(SEPARATOR);
            if (rule.pivotsOn(field)) {
                String value = event.valueOf(field);
                material.append(value != null ? value : NULL_ENTITY);
            }
        }
        material.append(SEPARATOR).append(timeBucket);

        return new GroupKey(rule.ruleId() + ":" + sha256(material.toString()), rule.ruleId(), timeBucket);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
