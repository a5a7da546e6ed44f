package com.bbthechange.activityfeed.service.impl;

import com.bbthechange.activityfeed.model.Activity;
import com.bbthechange.activityfeed.model.DeliveryRecord;
import com.bbthechange.activityfeed.model.FeedEntry;
import com.bbthechange.activityfeed.repository.FeedRepository;
import com.bbthechange.activityfeed.service.FeedMaterializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;

/**
 * Writes activities into recipients' streams. The new entry goes in before the replaced ones
 * come out, so a reader never sees the stream without the aggregate.
 */
@Service
public class FeedMaterializerImpl implements FeedMaterializer {

    private static final Logger logger = LoggerFactory.getLogger(FeedMaterializerImpl.class);

    private final FeedRepository feedRepository;

    public FeedMaterializerImpl(FeedRepository feedRepository) {
        this.feedRepository = feedRepository;
    }

    @Override
    public void materialize(DeliveryRecord record, Activity activity) {
        feedRepository.save(toEntry(record, activity));
        for (String replacedId : record.getReplacedActivityIds()) {
            feedRepository.delete(record.getRecipientId(), record.getStreamType(), replacedId);
        }
        logger.debug("Materialized activity {} in {} stream of {}",
                activity.getActivityId(), record.getStreamType(), record.getRecipientId());
    }

    static FeedEntry toEntry(DeliveryRecord record, Activity activity) {
        FeedEntry entry = new FeedEntry();
        entry.setRecipientId(record.getRecipientId());
        entry.setStreamType(record.getStreamType());
        entry.setActivityId(activity.getActivityId());
        entry.setVerb(activity.getVerb());
        entry.setActorIds(new ArrayList<>(activity.getActorIds()));
        entry.setObjectIds(new ArrayList<>(activity.getObjectIds()));
        entry.setTargetIds(new ArrayList<>(activity.getTargetIds()));
        entry.setRevision(activity.getRevision());
        entry.setPublishedAt(activity.getPublishedAt());
        return entry;
    }
}
