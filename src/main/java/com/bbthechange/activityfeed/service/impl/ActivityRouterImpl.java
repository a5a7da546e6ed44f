package com.bbthechange.activityfeed.service.impl;

import com.bbthechange.activityfeed.model.Activity;
import com.bbthechange.activityfeed.model.AggregationOutcome;
import com.bbthechange.activityfeed.model.DeliveryRecord;
import com.bbthechange.activityfeed.model.EmailPreference;
import com.bbthechange.activityfeed.model.StreamType;
import com.bbthechange.activityfeed.model.Visibility;
import com.bbthechange.activityfeed.repository.DeliveryRecordRepository;
import com.bbthechange.activityfeed.service.ActivityRouter;
import com.bbthechange.activityfeed.service.PrincipalDirectory;
import com.bbthechange.activityfeed.util.BucketAssigner;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Route and deliver.
 *
 * Visibility is checked against the principal service at routing time, not at event time, for
 * every principal the activity mentions. A recipient that may not see one of them does not get
 * the activity on that stream. A recipient that is only there as a follower must still follow
 * one of the principals that brought it in.
 */
@Service
public class ActivityRouterImpl implements ActivityRouter {

    private static final Logger logger = LoggerFactory.getLogger(ActivityRouterImpl.class);

    private final PrincipalDirectory principalDirectory;
    private final DeliveryRecordRepository deliveryRecordRepository;
    private final BucketAssigner bucketAssigner;
    private final MeterRegistry meterRegistry;

    public ActivityRouterImpl(PrincipalDirectory principalDirectory,
                              DeliveryRecordRepository deliveryRecordRepository,
                              BucketAssigner bucketAssigner,
                              MeterRegistry meterRegistry) {
        this.principalDirectory = principalDirectory;
        this.deliveryRecordRepository = deliveryRecordRepository;
        this.bucketAssigner = bucketAssigner;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public List<DeliveryRecord> route(AggregationOutcome outcome) {
        if (outcome.isRedundant()) {
            return List.of();
        }
        Activity activity = outcome.activity();
        LiveView view = new LiveView();
        List<DeliveryRecord> delivered = new ArrayList<>();

        for (StreamType stream : StreamType.values()) {
            for (String recipientId : outcome.deliverySet().recipientsFor(stream)) {
                if (!view.canSeeAll(recipientId, activity)
                        || !view.stillFollowsAny(recipientId, outcome.deliverySet().followedPrincipals(stream, recipientId))) {
                    logger.debug("Suppressed {} delivery of activity {} to {}",
                            stream, activity.getActivityId(), recipientId);
                    count(stream, "suppressed");
                    continue;
                }

                String bucketId = bucketFor(stream, recipientId);
                if (bucketId == null) {
                    count(stream, "opted_out");
                    continue;
                }

                DeliveryRecord record = new DeliveryRecord(bucketId, recipientId, stream,
                        activity.getActivityId(), outcome.replacedActivityIds(), activity.getPublishedAt());
                deliveryRecordRepository.upsert(record);
                delivered.add(record);
                count(stream, "queued");
            }
        }

        logger.debug("Routed activity {} to {} of {} candidate deliveries",
                activity.getActivityId(), delivered.size(), outcome.deliverySet().size());
        return delivered;
    }

    private String bucketFor(StreamType stream, String recipientId) {
        if (stream != StreamType.EMAIL) {
            return bucketAssigner.streamBucketId(stream, recipientId);
        }
        EmailPreference preference = principalDirectory.emailPreferenceOf(recipientId);
        if (preference == null || preference == EmailPreference.NEVER) {
            return null;
        }
        return bucketAssigner.emailBucketId(recipientId, preference, principalDirectory.timezoneOf(recipientId));
    }

    private void count(StreamType stream, String status) {
        meterRegistry.counter("activity_delivery_total", "stream", stream.name(), "status", status).increment();
    }

    /**
     * Answers from the principal directory, remembered for the duration of one routing pass only.
     */
    private final class LiveView {

        private final Map<String, Visibility> visibilities = new HashMap<>();
        private final Map<String, String> tenants = new HashMap<>();
        private final Map<String, Boolean> following = new HashMap<>();

        boolean canSeeAll(String recipientId, Activity activity) {
            for (String principalId : activity.entityIds()) {
                if (!canSee(recipientId, principalId)) {
                    return false;
                }
            }
            return true;
        }

        private boolean canSee(String recipientId, String principalId) {
            if (recipientId.equals(principalId)) {
                return true;
            }
            Visibility visibility = visibilities.computeIfAbsent(principalId, principalDirectory::currentVisibility);
            if (visibility == null) {
                return false;
            }
            return switch (visibility) {
                case PUBLIC -> principalDirectory.isSameOrFederatedTenant(tenant(principalId), tenant(recipientId));
                case LOGGEDIN -> Objects.equals(tenant(principalId), tenant(recipientId));
                case PRIVATE -> principalDirectory.isMemberOf(recipientId, principalId);
            };
        }

        boolean stillFollowsAny(String recipientId, Set<String> principalIds) {
            if (principalIds.isEmpty()) {
                return true;
            }
            for (String principalId : principalIds) {
                boolean follows = following.computeIfAbsent(recipientId + "|" + principalId,
                        pair -> principalDirectory.isFollowerOf(recipientId, principalId));
                if (follows) {
                    return true;
                }
            }
            return false;
        }

        private String tenant(String principalId) {
            return tenants.computeIfAbsent(principalId, principalDirectory::tenantOf);
        }
    }
}
