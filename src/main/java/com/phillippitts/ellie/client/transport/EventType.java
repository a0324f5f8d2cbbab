package com.phillippitts.ellie.client.transport;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Events seen by transport subscribers. Wire events travel in the {@code {type, data}} envelope;
 * lifecycle events are raised locally by the transport.
 */
public enum EventType {
    VOICE_INPUT("voice-input"),
    STATUS("status"),
    AI_RESPONSE("ai-response"),
    ERROR("error"),
    SESSION_JOINED("session-joined"),
    PING("ping"),
    PONG("pong"),

    CONNECT(null),
    DISCONNECT(null),
    RECONNECT_ATTEMPT(null),
    RECONNECT(null),
    RECONNECT_FAILED(null);

    private static final Map<String, EventType> BY_WIRE_NAME = Arrays.stream(values())
            .filter(EventType::isWireEvent)
            .collect(Collectors.toUnmodifiableMap(EventType::wireName, Function.identity()));

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isWireEvent() {
        return wireName != null;
    }

    /** Terminal events end a voice turn. */
    public boolean isTerminal() {
        return this == AI_RESPONSE || this == ERROR;
    }

    public static Optional<EventType> fromWire(String name) {
        return Optional.ofNullable(name == null ? null : BY_WIRE_NAME.get(name));
    }
}
