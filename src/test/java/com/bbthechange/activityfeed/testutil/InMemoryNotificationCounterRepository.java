package com.bbthechange.activityfeed.testutil;

import com.bbthechange.activityfeed.repository.NotificationCounterRepository;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public class InMemoryNotificationCounterRepository implements NotificationCounterRepository {

    private final Map<String, Long> unread = new HashMap<>();
    private final Map<String, Instant> lastRead = new HashMap<>();

    @Override
    public synchronized long increment(String userId, long delta) {
        return unread.merge(userId, delta, Long::sum);
    }

    @Override
    public synchronized void markRead(String userId, Instant readAt) {
        unread.put(userId, 0L);
        lastRead.put(userId, readAt);
    }

    @Override
    public synchronized long getUnreadCount(String userId) {
        return unread.getOrDefault(userId, 0L);
    }

    public synchronized Instant getLastReadAt(String userId) {
        return lastRead.get(userId);
    }
}
