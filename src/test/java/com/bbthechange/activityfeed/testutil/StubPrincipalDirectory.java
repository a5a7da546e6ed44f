package com.bbthechange.activityfeed.testutil;

import com.bbthechange.activityfeed.model.EmailPreference;
import com.bbthechange.activityfeed.model.PrincipalProfile;
import com.bbthechange.activityfeed.model.Visibility;
import com.bbthechange.activityfeed.service.PrincipalDirectory;
import com.bbthechange.activityfeed.service.RecipientResolver;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Principal service stand-in. Principals default to public users of tenant "acme" with
 * immediate email, unless a test registers them otherwise. Changes take effect on the next
 * lookup, like the live service.
 */
public class StubPrincipalDirectory implements PrincipalDirectory, RecipientResolver {

    public static final String DEFAULT_TENANT = "acme";

    private final Map<String, PrincipalProfile> profiles = new HashMap<>();
    private final Map<String, Set<String>> followers = new HashMap<>();
    private final Map<String, Set<String>> members = new HashMap<>();
    private final Set<String> federations = new HashSet<>();
    private int lookups;

    public StubPrincipalDirectory principal(String principalId, String tenant, Visibility visibility) {
        PrincipalProfile profile = profile(principalId);
        profile.setTenantAlias(tenant);
        profile.setVisibility(visibility);
        return this;
    }

    public StubPrincipalDirectory visibility(String principalId, Visibility visibility) {
        profile(principalId).setVisibility(visibility);
        return this;
    }

    public StubPrincipalDirectory emailPreference(String principalId, EmailPreference preference) {
        profile(principalId).setEmailPreference(preference);
        return this;
    }

    public StubPrincipalDirectory timezone(String principalId, String timezone) {
        profile(principalId).setTimezone(timezone);
        return this;
    }

    public StubPrincipalDirectory follower(String principalId, String followerId) {
        followers.computeIfAbsent(principalId, p -> new LinkedHashSet<>()).add(followerId);
        return this;
    }

    public StubPrincipalDirectory unfollow(String principalId, String followerId) {
        followers.getOrDefault(principalId, new HashSet<>()).remove(followerId);
        return this;
    }

    public StubPrincipalDirectory member(String groupId, String memberId) {
        members.computeIfAbsent(groupId, g -> new LinkedHashSet<>()).add(memberId);
        return this;
    }

    public StubPrincipalDirectory federate(String tenantA, String tenantB) {
        federations.add(tenantA + "|" + tenantB);
        federations.add(tenantB + "|" + tenantA);
        return this;
    }

    public int getLookups() {
        return lookups;
    }

    private PrincipalProfile profile(String principalId) {
        return profiles.computeIfAbsent(principalId, id ->
                new PrincipalProfile(id, DEFAULT_TENANT, Visibility.PUBLIC, EmailPreference.IMMEDIATE, null));
    }

    @Override
    public Visibility currentVisibility(String principalId) {
        lookups++;
        return profile(principalId).getVisibility();
    }

    @Override
    public boolean isFollowerOf(String userId, String principalId) {
        return followersOf(principalId).contains(userId);
    }

    @Override
    public boolean isMemberOf(String userId, String groupId) {
        return membersOf(groupId).contains(userId);
    }

    @Override
    public String tenantOf(String principalId) {
        lookups++;
        return profile(principalId).getTenantAlias();
    }

    @Override
    public boolean isSameOrFederatedTenant(String tenantA, String tenantB) {
        return tenantA.equals(tenantB) || federations.contains(tenantA + "|" + tenantB);
    }

    @Override
    public EmailPreference emailPreferenceOf(String userId) {
        return profile(userId).getEmailPreference();
    }

    @Override
    public String timezoneOf(String principalId) {
        return profile(principalId).getTimezone();
    }

    @Override
    public Set<String> followersOf(String principalId) {
        return followers.getOrDefault(principalId, Set.of());
    }

    @Override
    public Set<String> membersOf(String groupId) {
        return members.getOrDefault(groupId, Set.of());
    }
}
