package com.phillippitts.ellie.presentation.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.ellie.domain.AudioResponse;
import com.phillippitts.ellie.service.orchestration.ErrorResponse;
import com.phillippitts.ellie.service.orchestration.TurnEventSink;
import com.phillippitts.ellie.service.orchestration.TurnStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Delivers turn events to one WebSocket connection as {@code {type, data}} envelopes.
 *
 * <p>After {@link #detach()} every event is dropped silently. The session passed in must be safe
 * for concurrent sends (a {@code ConcurrentWebSocketSessionDecorator}).
 */
class WebSocketTurnSink implements TurnEventSink {

    private static final Logger LOG = LogManager.getLogger(WebSocketTurnSink.class);

    static final String STATUS = "status";
    static final String AI_RESPONSE = "ai-response";
    static final String ERROR = "error";

    private final WebSocketSession session;
    private final String sessionId;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean detached = new AtomicBoolean();

    WebSocketTurnSink(WebSocketSession session, String sessionId, ObjectMapper objectMapper) {
        this.session = session;
        this.sessionId = sessionId;
        this.objectMapper = objectMapper;
    }

    @Override
    public void status(TurnStatus state, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("state", state.name());
        data.put("message", message);
        data.put("sessionId", sessionId);
        data.put("timestamp", Instant.now().toString());
        send(STATUS, data);
    }

    @Override
    public void response(AudioResponse response) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("text", response.text());
        data.put("audioBuffer", Base64.getEncoder().encodeToString(response.audio()));
        data.put("confidence", response.confidence());
        data.put("processingTime", response.processingTimeMs());
        data.put("provider", response.provider());
        data.put("cached", response.cached());
        data.put("fallback", response.fallback());
        if (response.transcript() != null) {
            data.put("transcript", response.transcript());
        }
        send(AI_RESPONSE, data);
    }

    @Override
    public void error(ErrorResponse error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("code", error.code().name());
        data.put("message", error.message());
        if (error.details() != null) {
            data.put("details", error.details());
        }
        data.put("timestamp", error.timestamp().toString());
        data.put("requestId", error.requestId());
        data.put("sessionId", error.sessionId());
        send(ERROR, data);
    }

    /** Stops all further delivery. Turns still running complete without a receiver. */
    void detach() {
        detached.set(true);
    }

    boolean isDetached() {
        return detached.get();
    }

    /**
     * @return true when the envelope was written to the socket
     */
    boolean send(String type, Object data) {
        if (detached.get() || !session.isOpen()) {
            LOG.debug("Dropping {} for session {}: connection gone", type, sessionId);
            return false;
        }
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("type", type);
        envelope.put("data", data);
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(envelope)));
            return true;
        } catch (JsonProcessingException e) {
            LOG.error("Could not serialize {} for session {}", type, sessionId, e);
            return false;
        } catch (IOException | IllegalStateException e) {
            LOG.warn("Send of {} to session {} failed: {}", type, sessionId, e.toString());
            return false;
        }
    }
}
