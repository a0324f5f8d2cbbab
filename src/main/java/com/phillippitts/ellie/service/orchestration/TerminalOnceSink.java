package com.phillippitts.ellie.service.orchestration;

import com.phillippitts.ellie.domain.AudioResponse;
import com.phillippitts.ellie.exception.ErrorCode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wraps a caller's sink so a turn delivers exactly one terminal event and delivery failures
 * never reach the pipeline.
 */
final class TerminalOnceSink implements TurnEventSink {

    private static final Logger LOG = LogManager.getLogger(TerminalOnceSink.class);

    private final String sessionId;
    private final String requestId;
    private final TurnEventSink delegate;
    private final AtomicBoolean terminated = new AtomicBoolean();

    TerminalOnceSink(String sessionId, String requestId, TurnEventSink delegate) {
        this.sessionId = sessionId;
        this.requestId = requestId;
        this.delegate = delegate;
    }

    @Override
    public void status(TurnStatus state, String message) {
        if (terminated.get()) {
            return;
        }
        deliver(() -> delegate.status(state, message), "status");
    }

    @Override
    public void response(AudioResponse response) {
        if (!terminated.compareAndSet(false, true)) {
            LOG.warn("Dropping extra terminal response for session {}", sessionId);
            return;
        }
        deliver(() -> delegate.response(response), "ai-response");
    }

    @Override
    public void error(ErrorResponse error) {
        if (!terminated.compareAndSet(false, true)) {
            LOG.warn("Dropping extra terminal error {} for session {}", error.code(), sessionId);
            return;
        }
        deliver(() -> delegate.error(error), "error");
    }

    void error(ErrorCode code, String details) {
        error(ErrorResponse.of(code, details, requestId, sessionId));
    }

    boolean isTerminated() {
        return terminated.get();
    }

    private void deliver(Runnable delivery, String event) {
        try {
            delivery.run();
        } catch (RuntimeException e) {
            LOG.warn("Failed to deliver {} to session {}: {}", event, sessionId, e.toString());
        }
    }
}
