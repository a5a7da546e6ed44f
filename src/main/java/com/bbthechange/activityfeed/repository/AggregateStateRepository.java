package com.bbthechange.activityfeed.repository;

import com.bbthechange.activityfeed.model.AggregateState;

import java.util.Optional;

/**
 * Repository interface for the aggregate-state index.
 * Writes are compare-and-swap on the state's version.
 */
public interface AggregateStateRepository {

    /**
     * Find the state stored under a group key, using a strongly consistent read.
     * @param groupKey The group key
     * @return Optional containing the state, empty when the aggregate has never been written
     */
    Optional<AggregateState> find(String groupKey);

    /**
     * Write a state if the stored version still equals {@code state.getVersion()}.
     * A state with version 0 is only written if nothing is stored under its key.
     * @param state The state to write
     * @return The written state, carrying the incremented version
     * @throws com.bbthechange.activityfeed.exception.ConflictException if another writer got there first
     */
    AggregateState put(AggregateState state);
}
