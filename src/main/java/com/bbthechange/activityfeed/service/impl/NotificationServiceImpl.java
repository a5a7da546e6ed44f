package com.bbthechange.activityfeed.service.impl;

import com.bbthechange.activityfeed.model.Activity;
import com.bbthechange.activityfeed.model.DeliveryRecord;
import com.bbthechange.activityfeed.model.StreamType;
import com.bbthechange.activityfeed.repository.DeliveryRecordRepository;
import com.bbthechange.activityfeed.repository.FeedRepository;
import com.bbthechange.activityfeed.repository.NotificationCounterRepository;
import com.bbthechange.activityfeed.service.NotificationService;
import com.bbthechange.activityfeed.util.BucketAssigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Notification stream sink.
 *
 * Entries are materialized like activity-stream entries. The unread count only grows for
 * activities that are new to the user: a replacement of an entry still in the user's stream,
 * or a redelivery of the same activity, does not count again.
 */
@Service
public class NotificationServiceImpl implements NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationServiceImpl.class);

    private final FeedRepository feedRepository;
    private final NotificationCounterRepository counterRepository;
    private final DeliveryRecordRepository deliveryRecordRepository;
    private final BucketAssigner bucketAssigner;
    private final Clock clock;

    public NotificationServiceImpl(FeedRepository feedRepository,
                                   NotificationCounterRepository counterRepository,
                                   DeliveryRecordRepository deliveryRecordRepository,
                                   BucketAssigner bucketAssigner,
                                   Clock clock) {
        this.feedRepository = feedRepository;
        this.counterRepository = counterRepository;
        this.deliveryRecordRepository = deliveryRecordRepository;
        this.bucketAssigner = bucketAssigner;
        this.clock = clock;
    }

    @Override
    public void deliver(DeliveryRecord record, Activity activity) {
        String recipientId = record.getRecipientId();
        StreamType stream = record.getStreamType();

        boolean alreadyDelivered = feedRepository.find(recipientId, stream, activity.getActivityId()).isPresent();
        boolean replacesSeen = record.getReplacedActivityIds().stream()
                .anyMatch(replacedId -> feedRepository.find(recipientId, stream, replacedId).isPresent());

        feedRepository.save(FeedMaterializerImpl.toEntry(record, activity));
        for (String replacedId : record.getReplacedActivityIds()) {
            feedRepository.delete(recipientId, stream, replacedId);
        }

        if (!alreadyDelivered && !replacesSeen) {
            long unread = counterRepository.increment(recipientId, 1);
            logger.debug("User {} has {} unread notifications", recipientId, unread);
        }
    }

    @Override
    public void markNotificationsRead(String userId) {
        Instant now = clock.instant();
        counterRepository.markRead(userId, now);

        String immediateBucket = BucketAssigner.immediateEmailBucketId(bucketAssigner.bucketNumber(userId));
        List<DeliveryRecord> pending = deliveryRecordRepository.findByBucketAndRecipient(immediateBucket, userId);
        pending.forEach(deliveryRecordRepository::delete);

        logger.info("Marked notifications read for user {} and dropped {} pending immediate emails",
                userId, pending.size());
    }

    @Override
    public long getUnreadCount(String userId) {
        return counterRepository.getUnreadCount(userId);
    }
}
