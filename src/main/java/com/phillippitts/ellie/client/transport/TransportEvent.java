package com.phillippitts.ellie.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Objects;

/**
 * One event delivered to subscribers.
 *
 * @param type       event type
 * @param data       payload, an empty object when the event carries none
 * @param receivedAt local receipt time
 */
public record TransportEvent(EventType type, JsonNode data, Instant receivedAt) {

    public TransportEvent {
        Objects.requireNonNull(type, "type");
        data = data == null || data.isNull() || data.isMissingNode() ? JsonNodeFactory.instance.objectNode() : data;
        receivedAt = receivedAt == null ? Instant.now() : receivedAt;
    }

    static TransportEvent lifecycle(EventType type) {
        return new TransportEvent(type, null, Instant.now());
    }

    static TransportEvent disconnect(String reason) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("reason", reason);
        return new TransportEvent(EventType.DISCONNECT, data, Instant.now());
    }

    static TransportEvent attempt(EventType type, int attempt) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("attempt", attempt);
        return new TransportEvent(type, data, Instant.now());
    }

    /** Text field of the payload, or null. */
    public String text(String field) {
        JsonNode value = data.path(field);
        return value.isValueNode() ? value.asText() : null;
    }
}
