package com.bbthechange.activityfeed.util;

import com.bbthechange.activityfeed.exception.EventValidationException;
import com.bbthechange.activityfeed.model.RawEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON form of raw events on the ingest queue.
 *
 * Message format:
 * {"verb":"following-follow","actorId":"...","objectId":"...","targetId":null,
 *  "timestamp":1767226200000,"sourceContext":{"tenant":"..."}}
 *
 * The timestamp may also be an ISO-8601 instant.
 */
@Component
public class RawEventCodec {

    private final ObjectMapper objectMapper;

    public RawEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(RawEvent event) throws JsonProcessingException {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("verb", event.verb());
        node.put("actorId", event.actorId());
        node.put("objectId", event.objectId());
        if (event.targetId() != null) {
            node.put("targetId", event.targetId());
        }
        node.put("timestamp", event.timestamp().toEpochMilli());
        ObjectNode context = node.putObject("sourceContext");
        event.sourceContext().forEach(context::put);
        return objectMapper.writeValueAsString(node);
    }

    /**
     * @throws EventValidationException if the body is not JSON or misses a required field
     */
    public RawEvent fromJson(String messageBody) {
        JsonNode node;
        try {
            node = objectMapper.readTree(messageBody);
        } catch (JsonProcessingException e) {
            throw new EventValidationException("Raw event is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new EventValidationException("Raw event must be a JSON object");
        }

        Map<String, String> sourceContext = new LinkedHashMap<>();
        JsonNode contextNode = node.get("sourceContext");
        if (contextNode != null && contextNode.isObject()) {
            contextNode.fields().forEachRemaining(entry -> sourceContext.put(entry.getKey(), entry.getValue().asText()));
        }

        return new RawEvent(
                requiredText(node, "verb"),
                requiredText(node, "actorId"),
                requiredText(node, "objectId"),
                optionalText(node, "targetId"),
                timestamp(node),
                sourceContext);
    }

    private static String requiredText(JsonNode node, String field) {
        String value = optionalText(node, field);
        if (value == null || value.isBlank()) {
            throw EventValidationException.missingField(field);
        }
        return value;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static Instant timestamp(JsonNode node) {
        JsonNode value = node.get("timestamp");
        if (value == null || value.isNull()) {
            throw EventValidationException.missingField("timestamp");
        }
        if (value.isNumber()) {
            return Instant.ofEpochMilli(value.asLong());
        }
        try {
            return Instant.parse(value.asText());
        } catch (DateTimeParseException e) {
            throw new EventValidationException("Invalid timestamp: " + value.asText(), e);
        }
    }
}
