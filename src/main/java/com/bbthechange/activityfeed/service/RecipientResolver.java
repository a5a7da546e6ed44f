package com.bbthechange.activityfeed.service;

import java.util.Set;

/**
 * Expands a principal into the principals associated with it.
 */
public interface RecipientResolver {

    Set<String> followersOf(String principalId);

    Set<String> membersOf(String groupId);
}
