package com.bbthechange.activityfeed.service.impl;

import com.bbthechange.activityfeed.exception.DigestHandoffException;
import com.bbthechange.activityfeed.model.BucketCollectionResult;
import com.bbthechange.activityfeed.model.DeliveryRecord;
import com.bbthechange.activityfeed.model.EmailDigest;
import com.bbthechange.activityfeed.model.EmailPreference;
import com.bbthechange.activityfeed.model.StreamType;
import com.bbthechange.activityfeed.testutil.ActivityEngineHarness;
import com.bbthechange.activityfeed.util.BucketAssigner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.bbthechange.activityfeed.testutil.RawEventTestBuilder.BASE_TIME;
import static com.bbthechange.activityfeed.testutil.RawEventTestBuilder.follow;
import static org.assertj.core.api.Assertions.assertThat;

class EmailCollectorImplTest {

    private ActivityEngineHarness harness;

    @BeforeEach
    void setUp() {
        harness = new ActivityEngineHarness();
    }

    private List<DeliveryRecord> pendingEmails() {
        return harness.deliveries.findAll().stream()
                .filter(r -> r.getStreamType() == StreamType.EMAIL)
                .toList();
    }

    @Nested
    @DisplayName("immediate buckets")
    class Immediate {

        @Test
        @DisplayName("should send one email for three follows of the same user")
        void collectAllBuckets_ThreeFollows_OneEmail() {
            // Given
            harness.pipeline.process(follow("x1", "y", 10));
            harness.pipeline.process(follow("x2", "y", 11));
            harness.pipeline.process(follow("x3", "y", 12));
            assertThat(pendingEmails()).hasSize(3);

            // When
            harness.emailCollector.collectAllBuckets(harness.clock.instant());

            // Then
            List<EmailDigest> digests = harness.digestSink.sentTo("y");
            assertThat(digests).hasSize(1);
            EmailDigest digest = digests.get(0);
            assertThat(digest.preference()).isEqualTo(EmailPreference.IMMEDIATE);
            assertThat(digest.activities()).hasSize(1);
            assertThat(digest.activities().get(0).actorIds()).containsExactly("x1", "x2", "x3");
            assertThat(harness.digestSink.getSent()).hasSize(1);
            assertThat(pendingEmails()).isEmpty();
        }

        @Test
        @DisplayName("should hold a recipient back while activity is inside the grace period")
        void collectBucket_RecentActivity_Deferred() {
            // Given
            harness.clock.setInstant(BASE_TIME.plus(Duration.ofMinutes(11)));
            harness.pipeline.process(follow("x1", "y", 10));
            String bucketId = BucketAssigner.immediateEmailBucketId(harness.bucketAssigner.bucketNumber("y"));

            // When
            BucketCollectionResult first = harness.emailCollector.collectBucket(bucketId);

            // Then
            assertThat(first).isEqualTo(BucketCollectionResult.DRAINED);
            assertThat(harness.digestSink.getSent()).isEmpty();
            assertThat(pendingEmails()).hasSize(1);

            // When
            harness.clock.advance(Duration.ofMinutes(5));
            harness.emailCollector.collectBucket(bucketId);

            // Then
            assertThat(harness.digestSink.sentTo("y")).hasSize(1);
            assertThat(pendingEmails()).isEmpty();
        }

        @Test
        @DisplayName("should not queue email for recipients who opted out")
        void process_PreferenceNever_NoEmail() {
            // Given
            harness.principals.emailPreference("y", EmailPreference.NEVER);

            // When
            harness.pipeline.process(follow("x1", "y", 10));
            harness.emailCollector.collectAllBuckets(harness.clock.instant());

            // Then
            assertThat(pendingEmails()).isEmpty();
            assertThat(harness.digestSink.getSent()).isEmpty();
        }

        @Test
        @DisplayName("should keep the records and release the lease when the hand-off fails")
        void collectBucket_SinkFails_RecordsKept() {
            // Given
            harness.pipeline.process(follow("x1", "y", 10));
            harness.digestSink.failWith(new DigestHandoffException("queue down", null));
            String bucketId = BucketAssigner.immediateEmailBucketId(harness.bucketAssigner.bucketNumber("y"));

            // When
            BucketCollectionResult result = harness.emailCollector.collectBucket(bucketId);

            // Then
            assertThat(result).isEqualTo(BucketCollectionResult.FAILED);
            assertThat(pendingEmails()).hasSize(1);
            assertThat(harness.leases.isLeased(bucketId)).isFalse();
        }

        @Test
        @DisplayName("should drop records without mail when every activity was replaced")
        void collectBucket_AllActivitiesGone_NothingSent() {
            // Given
            harness.pipeline.process(follow("x1", "y", 10));
            harness.activities.findAll().forEach(a -> harness.activities.delete(a.getActivityId()));
            String bucketId = BucketAssigner.immediateEmailBucketId(harness.bucketAssigner.bucketNumber("y"));

            // When
            harness.emailCollector.collectBucket(bucketId);

            // Then
            assertThat(harness.digestSink.getSent()).isEmpty();
            assertThat(pendingEmails()).isEmpty();
        }
    }

    @Nested
    @DisplayName("scheduled buckets")
    class Scheduled {

        @BeforeEach
        void dailyRecipient() {
            harness.principals.emailPreference("y", EmailPreference.DAILY).timezone("y", "UTC");
            harness.pipeline.process(follow("x1", "y", 10));
        }

        @Test
        @DisplayName("should leave daily buckets alone outside their hour")
        void collectAllBuckets_NotDailyHour_DailyBucketUntouched() {
            // Given
            Instant now = BASE_TIME.plus(Duration.ofHours(6)).plus(Duration.ofMinutes(50));
            harness.clock.setInstant(now);
            String dailyBucket = BucketAssigner.dailyEmailBucketId(harness.bucketAssigner.bucketNumber("y"), 8);

            // When
            Map<String, BucketCollectionResult> results = harness.emailCollector.collectAllBuckets(now);

            // Then
            assertThat(results).doesNotContainKey(dailyBucket);
            assertThat(harness.digestSink.getSent()).isEmpty();
            assertThat(pendingEmails()).hasSize(1);
        }

        @Test
        @DisplayName("should collect the daily bucket in the pass before the configured hour")
        void collectAllBuckets_BeforeDailyHour_SendsDigest() {
            // Given
            Instant now = BASE_TIME.plus(Duration.ofHours(7)).plus(Duration.ofMinutes(50));
            harness.clock.setInstant(now);
            String dailyBucket = BucketAssigner.dailyEmailBucketId(harness.bucketAssigner.bucketNumber("y"), 8);

            // When
            Map<String, BucketCollectionResult> results = harness.emailCollector.collectAllBuckets(now);

            // Then
            assertThat(results).containsEntry(dailyBucket, BucketCollectionResult.DRAINED);
            List<EmailDigest> digests = harness.digestSink.sentTo("y");
            assertThat(digests).hasSize(1);
            assertThat(digests.get(0).preference()).isEqualTo(EmailPreference.DAILY);
            assertThat(pendingEmails()).isEmpty();
        }
    }
}
