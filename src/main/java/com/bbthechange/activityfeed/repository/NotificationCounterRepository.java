package com.bbthechange.activityfeed.repository;

import java.time.Instant;

/**
 * Repository interface for per-user unread notification counters.
 */
public interface NotificationCounterRepository {

    /**
     * Atomically add to a user's unread count.
     * @return The count after the increment
     */
    long increment(String userId, long delta);

    /**
     * Reset the unread count and remember when the user last read their notifications.
     */
    void markRead(String userId, Instant readAt);

    long getUnreadCount(String userId);
}
