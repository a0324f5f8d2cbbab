package com.phillippitts.ellie.exception;

/**
 * Thrown by the session transport. Sends while disconnected fail fast with
 * {@link TransportError#NOT_CONNECTED} instead of being queued.
 */
public class TransportException extends EllieException {

    private final TransportError transportError;

    public TransportException(TransportError transportError, String message) {
        this(transportError, message, null);
    }

    public TransportException(TransportError transportError, String message, Throwable cause) {
        super(transportError == TransportError.TIMEOUT
                ? ErrorCode.CONNECTION_TIMEOUT
                : ErrorCode.WEBSOCKET_CONNECTION_FAILED, message, cause);
        this.transportError = transportError;
    }

    public TransportError getTransportError() {
        return transportError;
    }
}
