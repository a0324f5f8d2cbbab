package com.phillippitts.ellie.client.transport;

import java.time.Instant;

/**
 * Immutable snapshot of the transport's connection.
 *
 * @param state             current state
 * @param reconnectAttempts attempts made since the last successful connection
 * @param lastError         description of the last failure, or null
 * @param since             when the current state was entered
 */
public record ConnectionStatus(ConnectionState state, int reconnectAttempts, String lastError, Instant since) {

    static ConnectionStatus initial() {
        return new ConnectionStatus(ConnectionState.DISCONNECTED, 0, null, Instant.now());
    }

    ConnectionStatus to(ConnectionState next, int attempts, String error) {
        return new ConnectionStatus(next, attempts, error, Instant.now());
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }
}
