package com.phillippitts.ellie.service.session;

import com.phillippitts.ellie.domain.ComplexityClass;
import com.phillippitts.ellie.domain.ConversationContext;
import com.phillippitts.ellie.domain.Message;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Server-side state of one client conversation.
 *
 * <p>Turns of a session are serialized through {@link #turnLock()}; different sessions never share
 * this object. History reads and writes are guarded by an internal lock so monitoring reads do not
 * have to wait for a running turn.
 *
 * <p><b>Thread Safety:</b> all public methods are thread-safe.
 */
public final class ConversationSession {

    private final String id;
    private final Instant createdAt;
    private final int maxHistory;
    private final Lock turnLock = new ReentrantLock();
    private final Lock historyLock = new ReentrantLock();
    private final List<Message> history = new ArrayList<>();

    private volatile Instant lastActivity;
    private volatile boolean connected = true;
    private ComplexityClass previousComplexity;

    // Guarded by this
    private int sockets;
    private Instant disconnectedAt;

    ConversationSession(String id, Instant createdAt, int maxHistory) {
        this.id = Objects.requireNonNull(id, "id");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.maxHistory = maxHistory;
        this.lastActivity = createdAt;
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public boolean isConnected() {
        return connected;
    }

    void markDisconnected() {
        connected = false;
    }

    synchronized void attach(Instant now) {
        sockets++;
        connected = true;
        disconnectedAt = null;
        lastActivity = now;
    }

    /**
     * @return true when the last socket holding this session went away
     */
    synchronized boolean detach(Instant now) {
        if (sockets == 0) {
            return false;
        }
        sockets--;
        if (sockets > 0) {
            return false;
        }
        connected = false;
        disconnectedAt = now;
        return true;
    }

    synchronized int socketCount() {
        return sockets;
    }

    /** True when every socket left before {@code cutoff} and none came back. */
    synchronized boolean disconnectedBefore(Instant cutoff) {
        return sockets == 0 && disconnectedAt != null && disconnectedAt.isBefore(cutoff);
    }

    void touch(Instant now) {
        lastActivity = now;
    }

    /** Lock held for the whole of one turn. */
    public Lock turnLock() {
        return turnLock;
    }

    /**
     * Appends one completed exchange and remembers its complexity for the next classification.
     * The oldest messages are dropped beyond the history limit.
     */
    public void recordExchange(Message user, Message assistant, ComplexityClass complexity) {
        historyLock.lock();
        try {
            history.add(user);
            history.add(assistant);
            while (history.size() > maxHistory) {
                history.remove(0);
            }
            previousComplexity = complexity;
        } finally {
            historyLock.unlock();
        }
    }

    /**
     * @param window maximum number of most recent messages to include
     */
    public ConversationContext context(int window) {
        historyLock.lock();
        try {
            int from = Math.max(0, history.size() - Math.max(0, window));
            return new ConversationContext(history.subList(from, history.size()), previousComplexity);
        } finally {
            historyLock.unlock();
        }
    }

    public List<Message> history() {
        historyLock.lock();
        try {
            return List.copyOf(history);
        } finally {
            historyLock.unlock();
        }
    }
}
