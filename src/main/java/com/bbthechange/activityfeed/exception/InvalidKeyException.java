package com.bbthechange.activityfeed.exception;

/**
 * Exception thrown when DynamoDB key validation fails.
 * Used by ActivityKeyFactory to reject ids that would corrupt the key layout.
 */
public class InvalidKeyException extends RuntimeException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
