package com.bbthechange.activityfeed.repository.impl;

import com.bbthechange.activityfeed.exception.TransientStoreException;
import com.bbthechange.activityfeed.model.DeliveryRecord;
import com.bbthechange.activityfeed.model.StreamType;
import com.bbthechange.activityfeed.util.QueryPerformanceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.PageIterable;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeliveryRecordRepositoryImplTest {

    @Mock
    private DynamoDbEnhancedClient enhancedClient;

    @Mock
    private DynamoDbTable<DeliveryRecord> deliveryTable;

    @Mock
    private PageIterable<DeliveryRecord> pages;

    @Mock
    private QueryPerformanceTracker performanceTracker;

    private DeliveryRecordRepositoryImpl repository;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        // Set up tracking to properly propagate calls
        lenient().when(performanceTracker.trackQuery(anyString(), anyString(), any())).thenAnswer(invocation -> {
            java.util.function.Supplier<?> supplier = invocation.getArgument(2);
            return supplier.get();
        });
        lenient().doAnswer(invocation -> {
            Runnable operation = invocation.getArgument(2);
            operation.run();
            return null;
        }).when(performanceTracker).track(anyString(), anyString(), any());

        when(enhancedClient.table(eq("ActivityTable"), any(TableSchema.class))).thenReturn(deliveryTable);
        repository = new DeliveryRecordRepositoryImpl(enhancedClient, performanceTracker);
    }

    private DeliveryRecord record(String recipientId, String activityId) {
        return new DeliveryRecord("activity:1", recipientId, StreamType.ACTIVITY, activityId, List.of(),
                Instant.parse("2026-01-01T00:10:00Z"));
    }

    @Test
    void upsert_WritesRecordUnderBucketPartition() {
        // Given
        DeliveryRecord record = record("simon", "a1");

        // When
        repository.upsert(record);

        // Then
        verify(deliveryTable).putItem(record);
        assertThat(record.getPk()).isEqualTo("BUCKET#activity:1");
        assertThat(record.getSk()).isEqualTo("RECIPIENT#simon#ACTIVITY#a1");
        assertThat(record.getUpdatedAt()).isNotNull();
    }

    @Test
    void findByBucket_ConsistentQueryCappedAtLimit() {
        // Given
        List<DeliveryRecord> stored = List.of(record("a", "a1"), record("b", "a1"), record("c", "a1"));
        when(pages.items()).thenReturn(stored::iterator);
        when(deliveryTable.query(any(QueryEnhancedRequest.class))).thenReturn(pages);

        // When
        List<DeliveryRecord> found = repository.findByBucket("activity:1", 2);

        // Then
        assertThat(found).extracting(DeliveryRecord::getRecipientId).containsExactly("a", "b");
        ArgumentCaptor<QueryEnhancedRequest> captor = ArgumentCaptor.forClass(QueryEnhancedRequest.class);
        verify(deliveryTable).query(captor.capture());
        assertThat(captor.getValue().consistentRead()).isTrue();
        assertThat(captor.getValue().limit()).isEqualTo(2);
    }

    @Test
    void delete_UsesRecordKey() {
        // Given
        DeliveryRecord record = record("simon", "a1");

        // When
        repository.delete(record);

        // Then
        ArgumentCaptor<Key> captor = ArgumentCaptor.forClass(Key.class);
        verify(deliveryTable).deleteItem(captor.capture());
        assertThat(captor.getValue().partitionKeyValue().s()).isEqualTo("BUCKET#activity:1");
        assertThat(captor.getValue().sortKeyValue()).hasValueSatisfying(
                sk -> assertThat(sk.s()).isEqualTo("RECIPIENT#simon#ACTIVITY#a1"));
    }

    @Test
    void upsert_StoreFails_ThrowsTransient() {
        // Given
        doThrow(DynamoDbException.builder().message("boom").build()).when(deliveryTable).putItem(any(DeliveryRecord.class));

        // When/Then
        assertThatThrownBy(() -> repository.upsert(record("simon", "a1"))).isInstanceOf(TransientStoreException.class);
    }
}
