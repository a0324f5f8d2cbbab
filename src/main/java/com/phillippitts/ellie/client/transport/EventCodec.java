package com.phillippitts.ellie.client.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * JSON {@code {"type": ..., "data": {...}}} envelope codec.
 */
public class EventCodec {

    private final ObjectMapper objectMapper;

    public EventCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * @throws IllegalArgumentException for lifecycle types or payloads Jackson cannot serialize
     */
    public String encode(EventType type, Object payload) {
        if (!type.isWireEvent()) {
            throw new IllegalArgumentException(type + " is not a wire event");
        }
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("type", type.wireName());
        envelope.set("data", payload == null ? objectMapper.createObjectNode() : objectMapper.valueToTree(payload));
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + type, e);
        }
    }

    /**
     * @return the event, or empty for malformed JSON or unknown types
     */
    public Optional<TransportEvent> decode(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        return EventType.fromWire(root.path("type").asText(null))
                .map(type -> new TransportEvent(type, root.path("data"), Instant.now()));
    }
}
