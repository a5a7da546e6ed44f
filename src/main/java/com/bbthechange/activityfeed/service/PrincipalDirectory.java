package com.bbthechange.activityfeed.service;

import com.bbthechange.activityfeed.model.EmailPreference;
import com.bbthechange.activityfeed.model.Visibility;

/**
 * Live answers about principals. Every call reflects the principal service at the time of the
 * call; results must not be cached beyond a single routing evaluation.
 */
public interface PrincipalDirectory {

    Visibility currentVisibility(String principalId);

    boolean isFollowerOf(String userId, String principalId);

    boolean isMemberOf(String userId, String groupId);

    String tenantOf(String principalId);

    /**
     * True if the tenants are the same or one may interact with the other.
     */
    boolean isSameOrFederatedTenant(String tenantA, String tenantB);

    EmailPreference emailPreferenceOf(String userId);

    /**
     * Timezone of the principal's tenant, or null if the tenant does not set one.
     */
    String timezoneOf(String principalId);
}
