package com.bbthechange.activityfeed.exception;

/**
 * Exception thrown when a store operation fails in a way that may succeed on retry.
 * Wraps lower-level DynamoDB exceptions; the ingest queue redelivers the event.
 */
public class TransientStoreException extends RuntimeException {

    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
