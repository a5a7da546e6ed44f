package com.bbthechange.activityfeed.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DeliverySetTest {

    @Test
    void addFollower_RemembersWhoWasFollowed() {
        // Given
        DeliverySet deliverySet = new DeliverySet();

        // When
        deliverySet.addFollower(StreamType.ACTIVITY, "simon", "bert");
        deliverySet.addFollower(StreamType.ACTIVITY, "simon", "branden");

        // Then
        assertThat(deliverySet.recipientsFor(StreamType.ACTIVITY)).containsExactly("simon");
        assertThat(deliverySet.followedPrincipals(StreamType.ACTIVITY, "simon")).containsExactly("bert", "branden");
        assertThat(deliverySet.followedPrincipals(StreamType.NOTIFICATION, "simon")).isEmpty();
    }

    @Test
    void add_DirectRecipient_NeedsNoFollowing() {
        // Given
        DeliverySet deliverySet = new DeliverySet();

        // When
        deliverySet.addFollower(StreamType.ACTIVITY, "simon", "bert");
        deliverySet.add(StreamType.ACTIVITY, "simon");

        // Then
        assertThat(deliverySet.recipientsFor(StreamType.ACTIVITY)).containsExactly("simon");
        assertThat(deliverySet.followedPrincipals(StreamType.ACTIVITY, "simon")).isEmpty();
        assertThat(deliverySet.size()).isEqualTo(1);
    }
}
