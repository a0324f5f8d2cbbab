package com.phillippitts.ellie.service.session;

import java.time.Instant;

/**
 * Published when the session sweep destroys a session.
 *
 * @param reason {@link #DISCONNECT_TIMEOUT} or {@link #IDLE_TIMEOUT}
 */
public record SessionEndedEvent(String sessionId, String reason, Instant at) {

    public static final String DISCONNECT_TIMEOUT = "disconnect-timeout";
    public static final String IDLE_TIMEOUT = "idle-timeout";
}
