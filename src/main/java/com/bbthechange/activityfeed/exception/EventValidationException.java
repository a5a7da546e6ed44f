package com.bbthechange.activityfeed.exception;

/**
 * Exception thrown when a raw event is malformed or names an unknown verb.
 * Such events are dropped rather than redelivered.
 */
public class EventValidationException extends RuntimeException {

    public EventValidationException(String message) {
        super(message);
    }

    public EventValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static EventValidationException missingField(String field) {
        return new EventValidationException("Raw event is missing required field: " + field);
    }

    public static EventValidationException unknownVerb(String verb) {
        return new EventValidationException("No activity type registered for verb: " + verb);
    }
}
