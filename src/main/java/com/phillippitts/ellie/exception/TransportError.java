package com.phillippitts.ellie.exception;

/**
 * Failure kinds of the client session transport.
 */
public enum TransportError {
    NOT_CONNECTED,
    TIMEOUT,
    RECONNECT_EXHAUSTED
}
