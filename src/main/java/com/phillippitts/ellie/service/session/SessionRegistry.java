package com.phillippitts.ellie.service.session;

import com.phillippitts.ellie.config.properties.SessionProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns all live {@link ConversationSession}s.
 *
 * <p>Sessions are created on first use. A WebSocket session counts the sockets attached to it;
 * when the last one closes the session is kept for {@code ellie.session.disconnect-grace-seconds}
 * so a reconnecting client finds its history again. Sessions with no socket are also swept after
 * {@code ellie.session.idle-timeout-minutes} without activity.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final SessionProperties props;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final ConcurrentMap<String, ConversationSession> sessions = new ConcurrentHashMap<>();

    @Autowired
    public SessionRegistry(SessionProperties props, ApplicationEventPublisher publisher) {
        this(props, publisher, Clock.systemUTC());
    }

    SessionRegistry(SessionProperties props, ApplicationEventPublisher publisher, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the session with this id, creating it if needed, and records activity on it.
     */
    public ConversationSession getOrCreate(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        Instant now = clock.instant();
        ConversationSession session = sessions.computeIfAbsent(sessionId, id -> {
            LOG.debug("Creating session {}", id);
            return new ConversationSession(id, now, props.getMaxHistoryMessages());
        });
        session.touch(now);
        return session;
    }

    public Optional<ConversationSession> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Attaches a socket to the session, creating the session if needed. Clears any pending
     * disconnect so the grace sweep leaves it alone.
     */
    public ConversationSession attach(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        Instant now = clock.instant();
        ConversationSession session = sessions.compute(sessionId, (id, existing) -> {
            ConversationSession target = existing != null
                    ? existing
                    : new ConversationSession(id, now, props.getMaxHistoryMessages());
            target.attach(now);
            return target;
        });
        LOG.debug("Socket attached to session {} ({} open)", sessionId, session.socketCount());
        return session;
    }

    /**
     * Detaches one socket. The session and its history stay until the grace period runs out
     * without a reconnect; a turn still running completes against it.
     */
    public void disconnect(String sessionId) {
        ConversationSession session = sessions.get(sessionId);
        if (session != null && session.detach(clock.instant())) {
            LOG.info("Session {} has no open socket; kept for {}s", sessionId, props.getDisconnectGraceSeconds());
        }
    }

    public int activeCount() {
        return sessions.size();
    }

    @Scheduled(fixedDelayString = "${ellie.session.sweep-interval-ms:60000}")
    public void sweep() {
        Instant now = clock.instant();
        Instant graceCutoff = now.minusSeconds(props.getDisconnectGraceSeconds());
        Instant idleCutoff = now.minus(Duration.ofMinutes(props.getIdleTimeoutMinutes()));
        Map<String, String> ended = new LinkedHashMap<>();
        for (String id : sessions.keySet()) {
            sessions.computeIfPresent(id, (key, session) -> {
                String reason = expiryReason(session, graceCutoff, idleCutoff);
                if (reason == null) {
                    return session;
                }
                session.markDisconnected();
                ended.put(key, reason);
                return null;
            });
        }
        ended.forEach((id, reason) -> publisher.publishEvent(new SessionEndedEvent(id, reason, now)));
        if (!ended.isEmpty()) {
            LOG.info("Ended {} sessions", ended.size());
        }
    }

    private static String expiryReason(ConversationSession session, Instant graceCutoff, Instant idleCutoff) {
        if (session.disconnectedBefore(graceCutoff)) {
            return SessionEndedEvent.DISCONNECT_TIMEOUT;
        }
        if (session.socketCount() == 0 && session.getLastActivity().isBefore(idleCutoff)) {
            return SessionEndedEvent.IDLE_TIMEOUT;
        }
        return null;
    }
}
