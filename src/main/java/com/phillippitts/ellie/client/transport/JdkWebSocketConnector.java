package com.phillippitts.ellie.client.transport;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@link TransportConnector} over {@link java.net.http.WebSocket}. Fragmented text frames are
 * reassembled before delivery.
 */
public class JdkWebSocketConnector implements TransportConnector {

    private static final Logger LOG = LogManager.getLogger(JdkWebSocketConnector.class);

    private final HttpClient httpClient;
    private final Duration connectTimeout;

    public JdkWebSocketConnector(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        this.httpClient = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
    }

    @Override
    public CompletableFuture<Connection> open(URI uri, Listener listener) {
        return httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, new FrameListener(listener))
                .thenApply(JdkConnection::new);
    }

    private record JdkConnection(WebSocket socket) implements Connection {
        @Override
        public CompletableFuture<Void> sendText(String text) {
            return socket.sendText(text, true).thenApply(ws -> null);
        }

        @Override
        public void close(int code, String reason) {
            socket.sendClose(code, reason).exceptionally(e -> {
                LOG.debug("Close handshake failed, aborting: {}", e.toString());
                socket.abort();
                return null;
            });
        }
    }

    private static final class FrameListener implements WebSocket.Listener {
        private final Listener delegate;
        private final StringBuilder partial = new StringBuilder();

        FrameListener(Listener delegate) {
            this.delegate = delegate;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String message = partial.toString();
                partial.setLength(0);
                delegate.onText(message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            delegate.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            delegate.onError(error);
        }
    }
}
