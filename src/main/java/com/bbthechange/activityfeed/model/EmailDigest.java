package com.bbthechange.activityfeed.model;

import java.time.Instant;
import java.util.List;

/**
 * One email worth of activities for a single recipient, handed to the mail renderer.
 */
public record EmailDigest(String recipientId, EmailPreference preference, List<DigestItem> activities, Instant collectedAt) {

    public EmailDigest {
        activities = List.copyOf(activities);
    }

    public record DigestItem(String activityId, String verb, List<String> actorIds, List<String> objectIds,
                             List<String> targetIds, Instant publishedAt) {

        public static DigestItem of(Activity activity) {
            return new DigestItem(activity.getActivityId(), activity.getVerb(),
                    List.copyOf(activity.getActorIds()), List.copyOf(activity.getObjectIds()),
                    List.copyOf(activity.getTargetIds()), activity.getPublishedAt());
        }
    }
}
