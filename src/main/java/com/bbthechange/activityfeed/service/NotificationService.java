package com.bbthechange.activityfeed.service;

import com.bbthechange.activityfeed.model.Activity;
import com.bbthechange.activityfeed.model.DeliveryRecord;

/**
 * Sink for notification-stream deliveries, plus the read-state of a user's notifications.
 */
public interface NotificationService {

    void deliver(DeliveryRecord record, Activity activity);

    /**
     * Reset the unread count and drop pending immediate emails, which would only repeat what
     * the user has just read.
     */
    void markNotificationsRead(String userId);

    long getUnreadCount(String userId);
}
