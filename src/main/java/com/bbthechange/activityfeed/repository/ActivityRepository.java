package com.bbthechange.activityfeed.repository;

import com.bbthechange.activityfeed.model.Activity;

import java.util.Optional;

/**
 * Repository interface for materialized activities.
 * Activities are written once and deleted when replaced; they are never updated in place.
 */
public interface ActivityRepository {

    /**
     * Store a new activity.
     * @param activity The activity to store
     * @return The stored activity
     */
    Activity save(Activity activity);

    /**
     * Find an activity by ID.
     * @param activityId The activity ID
     * @return Optional containing the activity if it is still live
     */
    Optional<Activity> findById(String activityId);

    /**
     * Delete an activity. Deleting an activity that does not exist is a no-op.
     * @param activityId The activity ID
     */
    void delete(String activityId);
}
