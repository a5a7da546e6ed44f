package com.bbthechange.activityfeed.repository;

import com.bbthechange.activityfeed.model.FeedEntry;
import com.bbthechange.activityfeed.model.StreamType;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for materialized feed and notification stream entries.
 */
public interface FeedRepository {

    void save(FeedEntry entry);

    Optional<FeedEntry> find(String recipientId, StreamType streamType, String activityId);

    void delete(String recipientId, StreamType streamType, String activityId);

    /**
     * Newest entries first.
     */
    List<FeedEntry> findStream(String recipientId, StreamType streamType, int limit);
}
