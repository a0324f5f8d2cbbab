package com.phillippitts.ellie.presentation.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.ellie.domain.AudioInput;
import com.phillippitts.ellie.exception.ErrorCode;
import com.phillippitts.ellie.service.orchestration.ErrorResponse;
import com.phillippitts.ellie.service.orchestration.ResponseOrchestrator;
import com.phillippitts.ellie.service.session.SessionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Voice session endpoint ({@code /ws/voice}).
 *
 * <p>On connect the handler assigns a session id (or adopts {@code ?sessionId=} from a reconnecting
 * client) and answers with {@code session-joined}. {@code voice-input} events start a turn whose
 * events flow back through a {@link WebSocketTurnSink}. On close the sink is detached: turns in
 * flight finish and fill the caches, but nothing more is sent. The conversation session itself
 * outlives the socket for the registry's grace period, so a client reconnecting with the same
 * {@code sessionId} picks up its history.
 */
@Component
public class VoiceWebSocketHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(VoiceWebSocketHandler.class);

    static final String SESSION_JOINED = "session-joined";
    static final String VOICE_INPUT = "voice-input";
    static final String PING = "ping";
    static final String PONG = "pong";

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT = 16 * 1024 * 1024;

    private final ResponseOrchestrator orchestrator;
    private final SessionRegistry sessions;
    private final ObjectMapper objectMapper;
    private final Map<String, Connection> bySocketId = new ConcurrentHashMap<>();

    private record Connection(String sessionId, WebSocketTurnSink sink) {
    }

    public VoiceWebSocketHandler(ResponseOrchestrator orchestrator, SessionRegistry sessions,
                                 ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.sessions = sessions;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession rawSession) {
        rawSession.setTextMessageSizeLimit(BUFFER_SIZE_LIMIT);
        WebSocketSession session = new ConcurrentWebSocketSessionDecorator(rawSession, SEND_TIME_LIMIT_MS,
                BUFFER_SIZE_LIMIT);
        String requested = readQuery(rawSession.getUri(), "sessionId");
        String sessionId = requested == null || requested.isBlank() ? UUID.randomUUID().toString() : requested;
        sessions.attach(sessionId);

        WebSocketTurnSink sink = new WebSocketTurnSink(session, sessionId, objectMapper);
        bySocketId.put(rawSession.getId(), new Connection(sessionId, sink));
        LOG.info("Voice session {} connected (socket {})", sessionId, rawSession.getId());

        Map<String, Object> joined = new LinkedHashMap<>();
        joined.put("sessionId", sessionId);
        joined.put("timestamp", Instant.now().toString());
        sink.send(SESSION_JOINED, joined);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Connection connection = bySocketId.get(session.getId());
        if (connection == null) {
            LOG.warn("Message on unknown socket {}", session.getId());
            return;
        }
        ThreadContext.put("sessionId", connection.sessionId());
        try {
            JsonNode root;
            try {
                root = objectMapper.readTree(message.getPayload());
            } catch (JsonProcessingException e) {
                rejectMalformed(connection, "Malformed JSON envelope");
                return;
            }
            String type = root.path("type").asText("");
            JsonNode data = root.path("data");
            switch (type) {
                case VOICE_INPUT -> onVoiceInput(connection, data);
                case PING -> connection.sink().send(PONG, Map.of("timestamp", Instant.now().toString()));
                case PONG -> LOG.trace("Pong from session {}", connection.sessionId());
                default -> rejectMalformed(connection, "Unsupported event type: " + type);
            }
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    private void onVoiceInput(Connection connection, JsonNode data) {
        String encoded = data.path("audio").asText(null);
        byte[] audio;
        try {
            audio = encoded == null ? new byte[0] : Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            connection.sink().error(ErrorResponse.of(ErrorCode.INVALID_AUDIO_FORMAT, "audio is not valid base64",
                    null, connection.sessionId()));
            return;
        }
        String format = data.path("format").asText("wav");
        long durationMs = data.path("durationMs").asLong(0L);
        LOG.debug("voice-input for session {}: {} bytes, format={}", connection.sessionId(), audio.length, format);
        orchestrator.handleVoiceInput(connection.sessionId(), new AudioInput(audio, format, durationMs),
                connection.sink());
    }

    private void rejectMalformed(Connection connection, String details) {
        LOG.warn("Rejected message from session {}: {}", connection.sessionId(), details);
        connection.sink().error(ErrorResponse.of(ErrorCode.INVALID_INPUT, details, null, connection.sessionId()));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("Transport error on socket {}: {}", session.getId(),
                exception == null ? "unknown" : exception.toString());
        close(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        LOG.info("Socket {} closed: {}", session.getId(), status);
        close(session.getId());
    }

    private void close(String socketId) {
        Connection connection = bySocketId.remove(socketId);
        if (connection != null) {
            connection.sink().detach();
            sessions.disconnect(connection.sessionId());
        }
    }

    int activeConnections() {
        return bySocketId.size();
    }

    private static String readQuery(URI uri, String key) {
        if (uri == null || uri.getQuery() == null || uri.getQuery().isBlank()) {
            return null;
        }
        for (String pair : uri.getQuery().split("&")) {
            String[] kv = pair.split("=", 2);
            if (kv.length == 2 && key.equals(kv[0])) {
                return kv[1];
            }
        }
        return null;
    }
}
