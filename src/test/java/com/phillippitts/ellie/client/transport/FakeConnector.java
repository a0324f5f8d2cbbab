package com.phillippitts.ellie.client.transport;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory connector. Each open either succeeds with a {@link FakeConnection} or is refused.
 */
class FakeConnector implements TransportConnector {

    final List<URI> opened = new CopyOnWriteArrayList<>();
    final List<FakeConnection> connections = new CopyOnWriteArrayList<>();
    volatile boolean refuse;

    @Override
    public CompletableFuture<Connection> open(URI uri, Listener listener) {
        opened.add(uri);
        if (refuse) {
            return CompletableFuture.failedFuture(new IOException("connection refused"));
        }
        FakeConnection connection = new FakeConnection(listener);
        connections.add(connection);
        return CompletableFuture.completedFuture(connection);
    }

    FakeConnection last() {
        return connections.get(connections.size() - 1);
    }

    static final class FakeConnection implements Connection {
        final Listener listener;
        final List<String> sent = new CopyOnWriteArrayList<>();
        volatile boolean closed;

        FakeConnection(Listener listener) {
            this.listener = listener;
        }

        @Override
        public CompletableFuture<Void> sendText(String text) {
            sent.add(text);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void close(int code, String reason) {
            closed = true;
        }

        void serverSends(String json) {
            listener.onText(json);
        }

        void drop() {
            listener.onClosed(1006, "abnormal");
        }
    }
}
