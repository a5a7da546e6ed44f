package com.bbthechange.activityfeed.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A single user action reported by a resource operation, before any grouping.
 * Target is optional; source context is carried for log correlation only.
 */
public record RawEvent(String verb,
                       String actorId,
                       String objectId,
                       String targetId,
                       Instant timestamp,
                       Map<String, String> sourceContext) {

    public RawEvent {
        sourceContext = sourceContext == null ? Map.of() : Map.copyOf(sourceContext);
    }

    public RawEvent(String verb, String actorId, String objectId, String targetId, Instant timestamp) {
        this(verb, actorId, objectId, targetId, timestamp, Map.of());
    }

    /**
     * Value of the given pivot field for this event, null when the event has no such entity.
     */
    public String valueOf(PivotField field) {
        return switch (field) {
            case ACTOR -> actorId;
            case OBJECT -> objectId;
            case TARGET -> targetId;
        };
    }

    /**
     * Deterministic id used to correlate log lines for redeliveries of the same event.
     */
    public String eventId() {
        return Integer.toHexString(Objects.hash(verb, actorId, objectId, targetId, timestamp));
    }
}
