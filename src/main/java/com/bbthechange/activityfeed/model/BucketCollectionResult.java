package com.bbthechange.activityfeed.model;

public enum BucketCollectionResult {
    /** The bucket was emptied under our lease. */
    DRAINED,
    /** Another collector holds the lease; nothing was handed to a sink. */
    CONTENDED,
    /** A sink or store failed; remaining records stay for the next sweep. */
    FAILED,
    /** Shutdown was requested while draining. */
    ABORTED
}
