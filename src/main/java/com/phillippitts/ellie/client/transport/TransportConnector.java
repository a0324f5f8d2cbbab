package com.phillippitts.ellie.client.transport;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens raw text-frame connections. The seam between {@link ReconnectingSessionTransport} and the
 * WebSocket implementation.
 */
public interface TransportConnector {

    CompletableFuture<Connection> open(URI uri, Listener listener);

    /** An open connection. */
    interface Connection {
        CompletableFuture<Void> sendText(String text);

        void close(int code, String reason);
    }

    /** Callbacks for one connection. Invoked on the connector's own threads. */
    interface Listener {
        void onText(String text);

        void onClosed(int code, String reason);

        void onError(Throwable error);
    }
}
