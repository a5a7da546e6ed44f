package com.bbthechange.activityfeed.model;

/**
 * One way an activity reaches a stream: take the principals in {@code entity} and deliver to the
 * principals related to them by {@code association}.
 */
public record StreamRoute(StreamType stream, PivotField entity, Association association, boolean excludeActors) {

    public enum Association {
        /** The principal itself. */
        SELF,
        /** Users following the principal. */
        FOLLOWERS,
        /** Members of a group principal. */
        MEMBERS
    }
}
