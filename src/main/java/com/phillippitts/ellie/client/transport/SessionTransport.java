package com.phillippitts.ellie.client.transport;

import com.phillippitts.ellie.exception.TransportException;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Duplex, auto-reconnecting event channel to the voice server.
 *
 * <p>Events of one connection are delivered in order on a single event loop thread. Nothing is
 * ordered across reconnects. A handler that throws is logged and does not affect other handlers.
 */
public interface SessionTransport {

    /**
     * Connects, retrying with backoff.
     *
     * @return completes on the first successful connection, or fails with
     *         {@link TransportException} once reconnect attempts are exhausted
     */
    CompletableFuture<Void> connect();

    /**
     * Sends one wire event.
     *
     * @throws TransportException {@code NOT_CONNECTED} immediately unless CONNECTED
     * @throws IllegalArgumentException for lifecycle event types
     */
    void send(EventType type, Object payload);

    /**
     * Sends an event and waits for the next terminal event ({@code ai-response} or {@code error}).
     *
     * @return completes with the terminal event, or fails with {@code TransportException(TIMEOUT)}
     */
    CompletableFuture<TransportEvent> request(EventType type, Object payload, Duration timeout);

    Unsubscribe on(EventType type, Consumer<TransportEvent> handler);

    /** Restarts reconnection with a fresh attempt budget. The way out of FAILED. */
    void forceReconnect();

    /** Closes the connection without reconnecting. */
    void disconnect();

    ConnectionStatus status();

    /** Session id assigned by the server, or null before the first {@code session-joined}. */
    String sessionId();
}
