package com.phillippitts.ellie.client.transport;

import com.phillippitts.ellie.exception.TransportError;
import com.phillippitts.ellie.exception.TransportException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link SessionTransport} with exponential-backoff reconnection.
 *
 * <p>All connection state is owned by a single-thread scheduled executor (the event loop).
 * Connector callbacks hop onto the loop and are tagged with a connection generation, so late
 * callbacks from a replaced connection are ignored.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>an unexpected close raises {@code DISCONNECT(reason)} and moves to RECONNECTING</li>
 *   <li>each retry raises {@code RECONNECT_ATTEMPT(n)}; success raises {@code RECONNECT(n)}</li>
 *   <li>after the last allowed attempt the state is FAILED and {@code RECONNECT_FAILED} is raised;
 *       nothing more happens until {@link #forceReconnect()}</li>
 * </ul>
 *
 * <p>After a {@code session-joined} the assigned session id is sent back on every reconnect so the
 * server keeps the conversation.
 */
public class ReconnectingSessionTransport implements SessionTransport {

    private static final Logger LOG = LogManager.getLogger(ReconnectingSessionTransport.class);

    static final int NORMAL_CLOSURE = 1000;

    private final URI serverUri;
    private final TransportConnector connector;
    private final EventCodec codec;
    private final BackoffPolicy backoff;
    private final ScheduledExecutorService loop;
    private final boolean ownsLoop;

    private final Map<EventType, List<Consumer<TransportEvent>>> handlers = new ConcurrentHashMap<>();
    private final Queue<CompletableFuture<TransportEvent>> pending = new ConcurrentLinkedQueue<>();

    // Owned by the loop thread
    private TransportConnector.Connection connection;
    private int generation;
    private int attempts;
    private boolean everConnected;
    private ScheduledFuture<?> scheduledAttempt;
    private CompletableFuture<Void> firstConnect;

    private volatile ConnectionStatus status = ConnectionStatus.initial();
    private volatile String sessionId;

    public ReconnectingSessionTransport(URI serverUri, TransportConnector connector, EventCodec codec,
                                        BackoffPolicy backoff) {
        this(serverUri, connector, codec, backoff, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-transport");
            t.setDaemon(true);
            return t;
        }), true);
    }

    // Package-private for tests
    ReconnectingSessionTransport(URI serverUri, TransportConnector connector, EventCodec codec,
                                 BackoffPolicy backoff, ScheduledExecutorService loop, boolean ownsLoop) {
        this.serverUri = Objects.requireNonNull(serverUri, "serverUri");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.ownsLoop = ownsLoop;
    }

    @Override
    public CompletableFuture<Void> connect() {
        CompletableFuture<Void> result = new CompletableFuture<>();
        onLoop(() -> {
            ConnectionState state = status.state();
            if (state == ConnectionState.CONNECTED) {
                result.complete(null);
                return;
            }
            if (firstConnect != null && !firstConnect.isDone()) {
                firstConnect.whenComplete((ok, error) -> complete(result, error));
                return;
            }
            firstConnect = result;
            if (state == ConnectionState.CONNECTING || state == ConnectionState.RECONNECTING) {
                return;
            }
            attempts = 0;
            transition(ConnectionState.CONNECTING, null);
            openConnection();
        });
        return result;
    }

    @Override
    public void send(EventType type, Object payload) {
        if (!type.isWireEvent()) {
            throw new IllegalArgumentException(type + " is raised locally and cannot be sent");
        }
        ConnectionState state = status.state();
        if (state != ConnectionState.CONNECTED) {
            throw new TransportException(TransportError.NOT_CONNECTED,
                    "Cannot send " + type.wireName() + " while " + state);
        }
        String text = codec.encode(type, payload);
        onLoop(() -> write(type, text));
    }

    @Override
    public CompletableFuture<TransportEvent> request(EventType type, Object payload, Duration timeout) {
        CompletableFuture<TransportEvent> reply = new CompletableFuture<>();
        pending.add(reply);
        try {
            send(type, payload);
        } catch (RuntimeException e) {
            pending.remove(reply);
            reply.completeExceptionally(e);
            return reply;
        }
        ScheduledFuture<?> timer = loop.schedule(() -> {
            if (pending.remove(reply)) {
                reply.completeExceptionally(new TransportException(TransportError.TIMEOUT,
                        "No reply to " + type.wireName() + " within " + timeout.toMillis() + "ms"));
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        reply.whenComplete((event, error) -> timer.cancel(false));
        return reply;
    }

    @Override
    public Unsubscribe on(EventType type, Consumer<TransportEvent> handler) {
        Objects.requireNonNull(handler, "handler");
        // Wrap so the same handler registered twice unsubscribes independently
        Consumer<TransportEvent> registration = handler::accept;
        List<Consumer<TransportEvent>> list = handlers.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>());
        list.add(registration);
        AtomicBoolean removed = new AtomicBoolean();
        return () -> {
            if (removed.compareAndSet(false, true)) {
                list.remove(registration);
            }
        };
    }

    @Override
    public void forceReconnect() {
        onLoop(() -> {
            cancelScheduledAttempt();
            if (status.state() == ConnectionState.CONNECTED) {
                dispatch(TransportEvent.disconnect("forced reconnect"));
                failPending(new TransportException(TransportError.NOT_CONNECTED, "Connection replaced"));
            }
            closeQuietly("forced reconnect");
            attempts = 1;
            transition(ConnectionState.RECONNECTING, null);
            dispatch(TransportEvent.attempt(EventType.RECONNECT_ATTEMPT, 1));
            openConnection();
        });
    }

    @Override
    public void disconnect() {
        onLoop(() -> {
            cancelScheduledAttempt();
            generation++;
            boolean wasConnected = status.state() == ConnectionState.CONNECTED;
            closeQuietly("client disconnect");
            attempts = 0;
            transition(ConnectionState.DISCONNECTED, null);
            if (wasConnected) {
                dispatch(TransportEvent.disconnect("client disconnect"));
            }
            TransportException closed = new TransportException(TransportError.NOT_CONNECTED, "Transport disconnected");
            failPending(closed);
            completeFirstConnect(closed);
        });
    }

    /** Disconnects and stops the event loop if this transport created it. */
    public void shutdown() {
        disconnect();
        if (ownsLoop) {
            loop.shutdown();
        }
    }

    @Override
    public ConnectionStatus status() {
        return status;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    private void openConnection() {
        int gen = ++generation;
        URI uri = withSession(serverUri, sessionId);
        CompletableFuture<TransportConnector.Connection> opening;
        try {
            opening = connector.open(uri, new ConnectionListener(gen));
        } catch (RuntimeException e) {
            opening = CompletableFuture.failedFuture(e);
        }
        opening.whenComplete((conn, error) -> onLoop(() -> onOpened(gen, conn, error)));
    }

    private void onOpened(int gen, TransportConnector.Connection conn, Throwable error) {
        if (gen != generation) {
            if (conn != null) {
                conn.close(NORMAL_CLOSURE, "superseded");
            }
            return;
        }
        if (error != null) {
            String reason = describe(error);
            LOG.warn("Connection attempt to {} failed: {}", serverUri, reason);
            scheduleReconnect(reason);
            return;
        }
        connection = conn;
        int madeAttempts = attempts;
        attempts = 0;
        transition(ConnectionState.CONNECTED, null);
        if (everConnected && madeAttempts > 0) {
            dispatch(TransportEvent.attempt(EventType.RECONNECT, madeAttempts));
        } else {
            dispatch(TransportEvent.lifecycle(EventType.CONNECT));
        }
        everConnected = true;
        completeFirstConnect(null);
    }

    private void onConnectionLost(int gen, String reason) {
        if (gen != generation) {
            return;
        }
        ConnectionState state = status.state();
        if (state == ConnectionState.DISCONNECTED || state == ConnectionState.FAILED) {
            return;
        }
        connection = null;
        if (state == ConnectionState.CONNECTED) {
            LOG.warn("Connection lost: {}", reason);
            dispatch(TransportEvent.disconnect(reason));
            failPending(new TransportException(TransportError.NOT_CONNECTED, "Connection lost: " + reason));
        }
        scheduleReconnect(reason);
    }

    private void scheduleReconnect(String reason) {
        int next = attempts + 1;
        if (!backoff.allows(next)) {
            transition(ConnectionState.FAILED, reason);
            LOG.error("Giving up after {} reconnect attempts: {}", attempts, reason);
            dispatch(TransportEvent.lifecycle(EventType.RECONNECT_FAILED));
            TransportException exhausted = new TransportException(TransportError.RECONNECT_EXHAUSTED,
                    "Reconnect attempts exhausted: " + reason);
            failPending(exhausted);
            completeFirstConnect(exhausted);
            return;
        }
        attempts = next;
        transition(ConnectionState.RECONNECTING, reason);
        Duration delay = backoff.delayBefore(next);
        LOG.info("Reconnect attempt {} in {}ms", next, delay.toMillis());
        scheduledAttempt = loop.schedule(() -> {
            if (status.state() != ConnectionState.RECONNECTING || attempts != next) {
                return;
            }
            dispatch(TransportEvent.attempt(EventType.RECONNECT_ATTEMPT, next));
            openConnection();
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onInbound(int gen, String text) {
        if (gen != generation) {
            return;
        }
        TransportEvent event = codec.decode(text).orElse(null);
        if (event == null) {
            LOG.debug("Ignoring unrecognized frame ({} chars)", text.length());
            return;
        }
        switch (event.type()) {
            case PING -> write(EventType.PONG, codec.encode(EventType.PONG, Map.of("timestamp", Instant.now().toString())));
            case SESSION_JOINED -> sessionId = event.text("sessionId");
            default -> {
                // no built-in handling
            }
        }
        if (event.type().isTerminal()) {
            CompletableFuture<TransportEvent> waiting = pending.poll();
            if (waiting != null) {
                waiting.complete(event);
            }
        }
        dispatch(event);
    }

    private void write(EventType type, String text) {
        TransportConnector.Connection current = connection;
        if (current == null) {
            LOG.warn("Dropping {}: connection lost before send", type.wireName());
            return;
        }
        current.sendText(text).whenComplete((ok, error) -> {
            if (error != null) {
                LOG.warn("Send of {} failed: {}", type.wireName(), describe(error));
            }
        });
    }

    private void dispatch(TransportEvent event) {
        for (Consumer<TransportEvent> handler : handlers.getOrDefault(event.type(), List.of())) {
            try {
                handler.accept(event);
            } catch (RuntimeException e) {
                LOG.warn("Handler for {} failed: {}", event.type(), e.toString());
            }
        }
    }

    private void transition(ConnectionState next, String error) {
        ConnectionStatus previous = status;
        status = previous.to(next, attempts, error);
        if (previous.state() != next) {
            LOG.info("Transport {} -> {}", previous.state(), next);
        }
    }

    private void failPending(TransportException error) {
        CompletableFuture<TransportEvent> waiting;
        while ((waiting = pending.poll()) != null) {
            waiting.completeExceptionally(error);
        }
    }

    private void completeFirstConnect(Throwable error) {
        if (firstConnect != null && !firstConnect.isDone()) {
            complete(firstConnect, error);
        }
    }

    private static void complete(CompletableFuture<Void> future, Throwable error) {
        if (error == null) {
            future.complete(null);
        } else {
            future.completeExceptionally(error);
        }
    }

    private void cancelScheduledAttempt() {
        if (scheduledAttempt != null) {
            scheduledAttempt.cancel(false);
            scheduledAttempt = null;
        }
    }

    private void closeQuietly(String reason) {
        TransportConnector.Connection current = connection;
        connection = null;
        if (current != null) {
            try {
                current.close(NORMAL_CLOSURE, reason);
            } catch (RuntimeException e) {
                LOG.debug("Close failed: {}", e.toString());
            }
        }
    }

    private void onLoop(Runnable task) {
        try {
            loop.execute(task);
        } catch (RejectedExecutionException e) {
            LOG.debug("Transport loop stopped; dropping task");
        }
    }

    static URI withSession(URI base, String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return base;
        }
        String separator = base.getRawQuery() == null ? "?" : "&";
        return URI.create(base + separator + "sessionId=" + URLEncoder.encode(sessionId, StandardCharsets.UTF_8));
    }

    private static String describe(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + (root.getMessage() == null ? "" : ": " + root.getMessage());
    }

    private final class ConnectionListener implements TransportConnector.Listener {
        private final int gen;

        ConnectionListener(int gen) {
            this.gen = gen;
        }

        @Override
        public void onText(String text) {
            onLoop(() -> onInbound(gen, text));
        }

        @Override
        public void onClosed(int code, String reason) {
            onLoop(() -> onConnectionLost(gen, "closed " + code + (reason == null || reason.isBlank() ? "" : " " + reason)));
        }

        @Override
        public void onError(Throwable error) {
            onLoop(() -> onConnectionLost(gen, describe(error)));
        }
    }
}
