package com.bbthechange.activityfeed.service;

import com.bbthechange.activityfeed.model.AggregationOutcome;
import com.bbthechange.activityfeed.model.DeliveryRecord;
import com.bbthechange.activityfeed.model.FeedEntry;
import com.bbthechange.activityfeed.model.StreamType;
import com.bbthechange.activityfeed.model.Visibility;
import com.bbthechange.activityfeed.service.impl.ActivityAggregatorImpl;
import com.bbthechange.activityfeed.service.impl.ActivityRouterImpl;
import com.bbthechange.activityfeed.testutil.ActivityEngineHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bbthechange.activityfeed.testutil.RawEventTestBuilder.follow;
import static org.assertj.core.api.Assertions.assertThat;

class ActivityPipelineTest {

    private ActivityEngineHarness harness;

    @BeforeEach
    void setUp() {
        harness = new ActivityEngineHarness();
    }

    @Test
    @DisplayName("should converge two follows by one user into a single feed entry")
    void process_TwoFollows_OneFeedEntry() {
        // Given
        harness.pipeline.process(follow("simon", "branden", 10));
        harness.collectFeeds();

        // When
        harness.pipeline.process(follow("simon", "bert", 12));
        harness.collectFeeds();

        // Then
        List<FeedEntry> simonsFeed = harness.feeds.findStream("simon", StreamType.ACTIVITY, 10);
        assertThat(simonsFeed).hasSize(1);
        assertThat(simonsFeed.get(0).getActorIds()).containsExactly("simon");
        assertThat(simonsFeed.get(0).getObjectIds()).containsExactlyInAnyOrder("branden", "bert");
        assertThat(harness.feeds.findStream("branden", StreamType.ACTIVITY, 10)).hasSize(1);
        assertThat(harness.feeds.findStream("bert", StreamType.ACTIVITY, 10)).hasSize(1);
    }

    @Test
    @DisplayName("should return nothing for a repeated event")
    void process_RepeatedEvent_NoDeliveries() {
        // Given
        harness.pipeline.process(follow("simon", "branden", 10));

        // When
        List<DeliveryRecord> deliveries = harness.pipeline.process(follow("simon", "branden", 10));

        // Then
        assertThat(deliveries).isEmpty();
    }

    @Test
    @DisplayName("should apply visibility as it stands when the event is routed")
    void process_ActorTurnsPrivate_OthersSuppressed() {
        // Given
        harness.principals.visibility("simon", Visibility.PRIVATE);

        // When
        List<DeliveryRecord> deliveries = harness.pipeline.process(follow("simon", "branden", 10));

        // Then
        assertThat(deliveries).extracting(DeliveryRecord::getRecipientId).containsOnly("simon");
    }

    @Test
    @DisplayName("should finish processing when an observer throws")
    void process_ObserverThrows_DeliveriesReturned() {
        // Given
        ActivityObserver failing = new ActivityObserver() {
            @Override
            public void onActivityMaterialized(AggregationOutcome outcome, List<DeliveryRecord> deliveries) {
                throw new IllegalStateException("observer down");
            }
        };
        ActivityAggregatorImpl aggregator = harness.aggregator;
        ActivityRouterImpl router = harness.router;
        ActivityPipeline pipeline = new ActivityPipeline(aggregator, router, new ActivityObservers(List.of(failing)));

        // When
        List<DeliveryRecord> deliveries = pipeline.process(follow("simon", "branden", 10));

        // Then
        assertThat(deliveries).isNotEmpty();
        assertThat(harness.activities.findAll()).hasSize(1);
    }
}
