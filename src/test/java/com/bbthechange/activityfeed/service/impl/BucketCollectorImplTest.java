package com.bbthechange.activityfeed.service.impl;

import com.bbthechange.activityfeed.model.Activity;
import com.bbthechange.activityfeed.model.BucketCollectionResult;
import com.bbthechange.activityfeed.model.DeliveryRecord;
import com.bbthechange.activityfeed.model.FeedEntry;
import com.bbthechange.activityfeed.model.StreamType;
import com.bbthechange.activityfeed.service.ActivityObservers;
import com.bbthechange.activityfeed.service.FeedMaterializer;
import com.bbthechange.activityfeed.testutil.ActivityEngineHarness;
import com.bbthechange.activityfeed.testutil.RawEventTestBuilder;
import com.bbthechange.activityfeed.util.BucketAssigner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class BucketCollectorImplTest {

    private static final Instant PUBLISHED = RawEventTestBuilder.BASE_TIME.plusSeconds(600);

    private ActivityEngineHarness harness;

    @BeforeEach
    void setUp() {
        harness = new ActivityEngineHarness();
    }

    private Activity storeActivity(String activityId, String actor, String object) {
        Activity activity = new Activity(activityId, "following-follow", List.of(actor), List.of(object), List.of(),
                PUBLISHED, "follow-by-actor:abc", 1);
        harness.activities.save(activity);
        return activity;
    }

    private DeliveryRecord queue(StreamType stream, String recipientId, String activityId, List<String> replaced) {
        DeliveryRecord record = new DeliveryRecord(harness.bucketAssigner.streamBucketId(stream, recipientId),
                recipientId, stream, activityId, replaced, PUBLISHED);
        harness.deliveries.upsert(record);
        return record;
    }

    private BucketCollectorImpl collectorWith(FeedMaterializer feedMaterializer) {
        BucketLeaseRunner runner = new BucketLeaseRunner(harness.leases, new ActivityObservers(List.of()),
                harness.properties, harness.meterRegistry);
        return new BucketCollectorImpl(runner, harness.deliveries, harness.activities, feedMaterializer,
                harness.notificationService, harness.properties);
    }

    @Nested
    @DisplayName("draining")
    class Draining {

        @Test
        @DisplayName("should materialize every record and empty the bucket")
        void collectBucket_PendingRecords_DrainsIntoFeeds() {
            // Given
            storeActivity("act-1", "simon", "branden");
            DeliveryRecord record = queue(StreamType.ACTIVITY, "branden", "act-1", List.of());
            int bucketNumber = harness.bucketAssigner.bucketNumber("branden");

            // When
            BucketCollectionResult result = harness.bucketCollector.collectBucket(StreamType.ACTIVITY, bucketNumber);

            // Then
            assertThat(result).isEqualTo(BucketCollectionResult.DRAINED);
            assertThat(harness.deliveries.findByBucket(record.getBucketId(), 10)).isEmpty();
            assertThat(harness.feeds.findStream("branden", StreamType.ACTIVITY, 10))
                    .extracting(FeedEntry::getActivityId)
                    .containsExactly("act-1");
            assertThat(harness.leases.isLeased(record.getBucketId())).isFalse();
            assertThat(harness.meterRegistry.counter("activity_drained_total", "stream", "ACTIVITY").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should replace the earlier entry when a replacement is drained")
        void collectBucket_Replacement_RemovesReplacedEntry() {
            // Given
            storeActivity("act-1", "simon", "branden");
            queue(StreamType.ACTIVITY, "branden", "act-1", List.of());
            harness.bucketCollector.collectAllBuckets(StreamType.ACTIVITY);

            harness.activities.delete("act-1");
            storeActivity("act-2", "simon", "branden");
            queue(StreamType.ACTIVITY, "branden", "act-2", List.of("act-1"));

            // When
            harness.bucketCollector.collectAllBuckets(StreamType.ACTIVITY);

            // Then
            assertThat(harness.feeds.findStream("branden", StreamType.ACTIVITY, 10))
                    .extracting(FeedEntry::getActivityId)
                    .containsExactly("act-2");
        }

        @Test
        @DisplayName("should drop records whose activity was already replaced")
        void collectBucket_StaleRecord_DeletedWithoutDelivery() {
            // Given
            DeliveryRecord stale = queue(StreamType.ACTIVITY, "branden", "gone", List.of());

            // When
            BucketCollectionResult result = harness.bucketCollector.collectBucket(StreamType.ACTIVITY,
                    harness.bucketAssigner.bucketNumber("branden"));

            // Then
            assertThat(result).isEqualTo(BucketCollectionResult.DRAINED);
            assertThat(harness.deliveries.findByBucket(stale.getBucketId(), 10)).isEmpty();
            assertThat(harness.feeds.findStream("branden", StreamType.ACTIVITY, 10)).isEmpty();
        }

        @Test
        @DisplayName("should page through buckets larger than one batch")
        void collectBucket_MoreThanOneBatch_DrainsAll() {
            // Given
            harness.properties.getCollection().setBatchSize(2);
            for (int i = 0; i < 5; i++) {
                storeActivity("act-" + i, "user-" + i, "branden");
                queue(StreamType.ACTIVITY, "branden", "act-" + i, List.of());
            }

            // When
            harness.bucketCollector.collectBucket(StreamType.ACTIVITY, harness.bucketAssigner.bucketNumber("branden"));

            // Then
            assertThat(harness.deliveries.findAll()).isEmpty();
            assertThat(harness.feeds.findStream("branden", StreamType.ACTIVITY, 10)).hasSize(5);
        }

        @Test
        @DisplayName("should route notification records to the notification service")
        void collectBucket_NotificationStream_CountsUnread() {
            // Given
            storeActivity("act-1", "simon", "branden");
            queue(StreamType.NOTIFICATION, "branden", "act-1", List.of());

            // When
            harness.bucketCollector.collectAllBuckets(StreamType.NOTIFICATION);

            // Then
            assertThat(harness.notificationService.getUnreadCount("branden")).isEqualTo(1);
            assertThat(harness.feeds.findStream("branden", StreamType.NOTIFICATION, 10)).hasSize(1);
            assertThat(harness.feeds.findStream("branden", StreamType.ACTIVITY, 10)).isEmpty();
        }
    }

    @Nested
    @DisplayName("leases")
    class Leases {

        @Test
        @DisplayName("should report contention and write nothing when another collector holds the lease")
        void collectBucket_LeaseHeld_Contended() {
            // Given
            storeActivity("act-1", "simon", "branden");
            DeliveryRecord record = queue(StreamType.ACTIVITY, "branden", "act-1", List.of());
            harness.leases.tryAcquire(record.getBucketId(), Duration.ofSeconds(60));

            // When
            BucketCollectionResult result = harness.bucketCollector.collectBucket(StreamType.ACTIVITY,
                    harness.bucketAssigner.bucketNumber("branden"));

            // Then
            assertThat(result).isEqualTo(BucketCollectionResult.CONTENDED);
            assertThat(harness.deliveries.findAll()).containsExactly(record);
            assertThat(harness.feeds.findStream("branden", StreamType.ACTIVITY, 10)).isEmpty();
        }

        @Test
        @DisplayName("should let exactly one of two overlapping collections drain a bucket")
        void collectBucket_OverlappingCollections_OneDrainsOneContended() {
            // Given
            storeActivity("act-1", "simon", "branden");
            queue(StreamType.ACTIVITY, "branden", "act-1", List.of());
            int bucketNumber = harness.bucketAssigner.bucketNumber("branden");

            FeedMaterializer feedMaterializer = mock(FeedMaterializer.class);
            List<BucketCollectionResult> overlapping = new ArrayList<>();
            BucketCollectorImpl[] collector = new BucketCollectorImpl[1];
            doAnswer(invocation -> {
                overlapping.add(collector[0].collectBucket(StreamType.ACTIVITY, bucketNumber));
                return null;
            }).when(feedMaterializer).materialize(any(), any());
            collector[0] = collectorWith(feedMaterializer);

            // When
            BucketCollectionResult result = collector[0].collectBucket(StreamType.ACTIVITY, bucketNumber);

            // Then
            assertThat(result).isEqualTo(BucketCollectionResult.DRAINED);
            assertThat(overlapping).containsExactly(BucketCollectionResult.CONTENDED);
            verify(feedMaterializer).materialize(any(), any());
        }

        @Test
        @DisplayName("should release the lease and keep the records when the sink fails")
        void collectBucket_SinkFails_FailedAndReverted() {
            // Given
            storeActivity("act-1", "simon", "branden");
            DeliveryRecord record = queue(StreamType.ACTIVITY, "branden", "act-1", List.of());
            FeedMaterializer feedMaterializer = mock(FeedMaterializer.class);
            doThrow(new IllegalStateException("feed store down")).when(feedMaterializer).materialize(any(), any());
            BucketCollectorImpl collector = collectorWith(feedMaterializer);

            // When
            BucketCollectionResult result = collector.collectBucket(StreamType.ACTIVITY,
                    harness.bucketAssigner.bucketNumber("branden"));

            // Then
            assertThat(result).isEqualTo(BucketCollectionResult.FAILED);
            assertThat(harness.leases.isLeased(record.getBucketId())).isFalse();
            assertThat(harness.deliveries.findAll()).containsExactly(record);
            assertThat(harness.meterRegistry.counter("activity_collection_total",
                    "stream", "ACTIVITY", "status", "failed").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should take over a lease that expired without being released")
        void collectBucket_ExpiredLease_Drains() {
            // Given
            storeActivity("act-1", "simon", "branden");
            DeliveryRecord record = queue(StreamType.ACTIVITY, "branden", "act-1", List.of());
            harness.leases.tryAcquire(record.getBucketId(), Duration.ofSeconds(60));
            harness.clock.advance(Duration.ofSeconds(61));

            // When
            BucketCollectionResult result = harness.bucketCollector.collectBucket(StreamType.ACTIVITY,
                    harness.bucketAssigner.bucketNumber("branden"));

            // Then
            assertThat(result).isEqualTo(BucketCollectionResult.DRAINED);
            assertThat(harness.deliveries.findAll()).isEmpty();
        }
    }

    @Nested
    @DisplayName("sweeps")
    class Sweeps {

        @Test
        @DisplayName("should visit every bucket of the stream")
        void collectAllBuckets_ReportsEveryBucket() {
            // When
            Map<String, BucketCollectionResult> results = harness.bucketCollector.collectAllBuckets(StreamType.ACTIVITY);

            // Then
            assertThat(results).containsOnlyKeys(
                    BucketAssigner.bucketId(StreamType.ACTIVITY, 0),
                    BucketAssigner.bucketId(StreamType.ACTIVITY, 1),
                    BucketAssigner.bucketId(StreamType.ACTIVITY, 2));
            assertThat(results.values()).containsOnly(BucketCollectionResult.DRAINED);
        }

        @Test
        @DisplayName("should not start buckets after shutdown")
        void collectBucket_AfterShutdown_Aborted() {
            // Given
            storeActivity("act-1", "simon", "branden");
            queue(StreamType.ACTIVITY, "branden", "act-1", List.of());
            harness.bucketCollector.shutdown();

            // When
            BucketCollectionResult result = harness.bucketCollector.collectBucket(StreamType.ACTIVITY,
                    harness.bucketAssigner.bucketNumber("branden"));

            // Then
            assertThat(result).isEqualTo(BucketCollectionResult.ABORTED);
            assertThat(harness.deliveries.findAll()).hasSize(1);
            assertThat(harness.bucketCollector.collectAllBuckets(StreamType.ACTIVITY)).isEmpty();
        }

        @Test
        @DisplayName("should refuse email buckets")
        void collectBucket_EmailStream_Rejected() {
            FeedMaterializer feedMaterializer = mock(FeedMaterializer.class);
            BucketCollectorImpl collector = collectorWith(feedMaterializer);

            assertThatThrownBy(() -> collector.collectBucket(StreamType.EMAIL, 0))
                    .isInstanceOf(IllegalArgumentException.class);
            verify(feedMaterializer, never()).materialize(any(), any());
        }
    }
}
