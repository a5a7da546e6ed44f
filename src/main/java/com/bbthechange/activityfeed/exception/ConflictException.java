package com.bbthechange.activityfeed.exception;

/**
 * Exception thrown when a compare-and-swap write on an aggregate finds a different version
 * than the one it read.
 *
 * The aggregator retries internally; this only escapes to the queue after the retry
 * budget is spent.
 */
public class ConflictException extends RuntimeException {

    private final String groupKey;
    private final long expectedVersion;

    public ConflictException(String groupKey, long expectedVersion, Throwable cause) {
        super("Aggregate " + groupKey + " changed since version " + expectedVersion, cause);
        this.groupKey = groupKey;
        this.expectedVersion = expectedVersion;
    }

    public ConflictException(String message) {
        super(message);
        this.groupKey = null;
        this.expectedVersion = -1L;
    }

    public String getGroupKey() {
        return groupKey;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
