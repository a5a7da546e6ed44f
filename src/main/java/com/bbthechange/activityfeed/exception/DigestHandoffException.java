package com.bbthechange.activityfeed.exception;

/**
 * Exception thrown when a digest email could not be handed to the mail queue.
 * The recipient's pending deliveries are kept for the next pass.
 */
public class DigestHandoffException extends RuntimeException {

    public DigestHandoffException(String message, Throwable cause) {
        super(message, cause);
    }
}
