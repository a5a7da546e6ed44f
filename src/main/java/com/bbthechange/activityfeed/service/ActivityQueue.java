package com.bbthechange.activityfeed.service;

import com.bbthechange.activityfeed.model.RawEvent;

/**
 * Durable, at-least-once ingest queue for raw events.
 */
public interface ActivityQueue {

    /**
     * Hand an event to the queue. Failures are logged and counted, never thrown at the caller.
     */
    void enqueue(RawEvent event);
}
