package com.bbthechange.activityfeed.util;

import com.bbthechange.activityfeed.exception.InvalidKeyException;
import com.bbthechange.activityfeed.model.StreamType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ActivityKeyFactoryTest {

    @Test
    void getActivityPk_WithValidId_ShouldReturnCorrectKey() {
        assertThat(ActivityKeyFactory.getActivityPk("a1")).isEqualTo("ACTIVITY#a1");
        assertThat(ActivityKeyFactory.getMetadataSk()).isEqualTo("METADATA");
    }

    @Test
    void getDeliverySk_ShouldGroupByRecipient() {
        // When
        String sk = ActivityKeyFactory.getDeliverySk("simon", "a1");

        // Then
        assertThat(sk).isEqualTo("RECIPIENT#simon#ACTIVITY#a1");
        assertThat(sk).startsWith(ActivityKeyFactory.getRecipientSkPrefix("simon"));
        assertThat(sk).doesNotStartWith(ActivityKeyFactory.getRecipientSkPrefix("sim"));
    }

    @Test
    void getFeedPk_ShouldIncludeStream() {
        assertThat(ActivityKeyFactory.getFeedPk("simon", StreamType.NOTIFICATION))
                .isEqualTo("FEED#simon#NOTIFICATION");
    }

    @Test
    void bucketAndLeaseKeys_ShouldShareBucketId() {
        assertThat(ActivityKeyFactory.getBucketPk("email:1:daily:8")).isEqualTo("BUCKET#email:1:daily:8");
        assertThat(ActivityKeyFactory.getLeasePk("email:1:daily:8")).isEqualTo("LEASE#email:1:daily:8");
    }

    @Test
    void getUserPk_WithDelimiter_ShouldThrowException() {
        assertThatThrownBy(() -> ActivityKeyFactory.getUserPk("evil#user"))
                .isInstanceOf(InvalidKeyException.class)
                .hasMessageContaining("Invalid User ID format");
    }

    @Test
    void getAggregatePk_WithBlankKey_ShouldThrowException() {
        assertThatThrownBy(() -> ActivityKeyFactory.getAggregatePk("  "))
                .isInstanceOf(InvalidKeyException.class)
                .hasMessageContaining("cannot be null or empty");
    }
}
