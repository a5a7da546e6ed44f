package com.bbthechange.activityfeed.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Candidate recipients per stream, before the live visibility check.
 */
public final class DeliverySet {

    private final Map<StreamType, Set<String>> recipients = new EnumMap<>(StreamType.class);
    private final Map<StreamType, Set<String>> direct = new EnumMap<>(StreamType.class);
    private final Map<StreamType, Map<String, Set<String>>> followed = new EnumMap<>(StreamType.class);

    /**
     * A recipient reached directly, as the principal itself or one of its members.
     */
    public void add(StreamType stream, String recipientId) {
        recipients.computeIfAbsent(stream, s -> new LinkedHashSet<>()).add(recipientId);
        direct.computeIfAbsent(stream, s -> new HashSet<>()).add(recipientId);
    }

    /**
     * A recipient reached because it follows {@code principalId}.
     */
    public void addFollower(StreamType stream, String recipientId, String principalId) {
        recipients.computeIfAbsent(stream, s -> new LinkedHashSet<>()).add(recipientId);
        followed.computeIfAbsent(stream, s -> new HashMap<>())
                .computeIfAbsent(recipientId, r -> new LinkedHashSet<>())
                .add(principalId);
    }

    /**
     * Principals whose followers are the only reason {@code recipientId} is on this stream.
     * Empty when the recipient was also reached directly.
     */
    public Set<String> followedPrincipals(StreamType stream, String recipientId) {
        if (direct.getOrDefault(stream, Set.of()).contains(recipientId)) {
            return Set.of();
        }
        return Collections.unmodifiableSet(
                followed.getOrDefault(stream, Map.of()).getOrDefault(recipientId, Set.of()));
    }

    public Set<String> recipientsFor(StreamType stream) {
        return Collections.unmodifiableSet(recipients.getOrDefault(stream, Set.of()));
    }

    public boolean isEmpty() {
        return recipients.values().stream().allMatch(Set::isEmpty);
    }

    public int size() {
        return recipients.values().stream().mapToInt(Set::size).sum();
    }

    public static DeliverySet empty() {
        return new DeliverySet();
    }

    @Override
    public String toString() {
        return "DeliverySet" + recipients;
    }
}
