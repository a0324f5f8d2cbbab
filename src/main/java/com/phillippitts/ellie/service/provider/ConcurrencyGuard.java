package com.phillippitts.ellie.service.provider;

import com.phillippitts.ellie.exception.ProviderUnavailableException;
import com.phillippitts.ellie.service.provider.event.ProviderFailureEvent;
import com.phillippitts.ellie.util.TimeUtils;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caps in-flight calls to one provider, both per session and across all sessions.
 *
 * <p>A caller waits at most {@code acquireTimeoutMs} in total for both permits. On timeout a
 * {@link ProviderFailureEvent} is published and {@link ProviderUnavailableException} is thrown,
 * which the orchestrator treats like any other provider failure and falls back.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * try (ConcurrencyGuard.Permit permit = guard.acquire(sessionId)) {
 *     // ... call provider ...
 * }
 * }</pre>
 *
 * <p>Thread-safe. Each permit releases exactly once no matter how often it is closed.
 */
public final class ConcurrencyGuard {

    private final String providerName;
    private final Semaphore global;
    private final int perSessionPermits;
    private final long acquireTimeoutMs;
    private final ApplicationEventPublisher publisher;
    private final ConcurrentMap<String, Semaphore> perSession = new ConcurrentHashMap<>();

    /**
     * @param providerName      provider guarded, used in errors and events
     * @param globalPermits     calls allowed across all sessions
     * @param perSessionPermits calls allowed per session
     * @param acquireTimeoutMs  total wait for both permits
     * @param publisher         event publisher for failure notifications (nullable)
     */
    public ConcurrencyGuard(String providerName,
                            int globalPermits,
                            int perSessionPermits,
                            long acquireTimeoutMs,
                            ApplicationEventPublisher publisher) {
        if (globalPermits <= 0 || perSessionPermits <= 0) {
            throw new IllegalArgumentException("Permit counts must be positive");
        }
        this.providerName = Objects.requireNonNull(providerName, "providerName");
        this.global = new Semaphore(globalPermits, true);
        this.perSessionPermits = perSessionPermits;
        this.acquireTimeoutMs = acquireTimeoutMs;
        this.publisher = publisher;
    }

    /**
     * Acquires a session permit, then a global permit, within the configured wait.
     *
     * @throws ProviderUnavailableException when either cap is still full after the wait,
     *         or the thread is interrupted while waiting
     */
    public Permit acquire(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(acquireTimeoutMs);
        Semaphore session = perSession.computeIfAbsent(sessionId, id -> new Semaphore(perSessionPermits));
        try {
            if (!session.tryAcquire(acquireTimeoutMs, TimeUnit.MILLISECONDS)) {
                throw limitReached("session", sessionId);
            }
            boolean acquiredGlobal;
            try {
                acquiredGlobal = global.tryAcquire(TimeUtils.remainingMillis(deadline), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                session.release();
                throw e;
            }
            if (!acquiredGlobal) {
                session.release();
                throw limitReached("global", sessionId);
            }
            return new Permit(session);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException("Interrupted while waiting for concurrency permit", providerName, e);
        }
    }

    /** Drops the per-session semaphore when a session ends. */
    public void forgetSession(String sessionId) {
        perSession.remove(sessionId);
    }

    public String getProviderName() {
        return providerName;
    }

    public int availableGlobalPermits() {
        return global.availablePermits();
    }

    private ProviderUnavailableException limitReached(String scope, String sessionId) {
        if (publisher != null) {
            Map<String, String> context = new LinkedHashMap<>();
            context.put("reason", "concurrency-limit");
            context.put("scope", scope);
            context.put("sessionId", sessionId);
            context.put("timeoutMs", String.valueOf(acquireTimeoutMs));
            publisher.publishEvent(new ProviderFailureEvent(providerName, Instant.now(),
                    scope + " concurrency limit reached after " + acquireTimeoutMs + "ms wait", null, context));
        }
        return new ProviderUnavailableException(
                scope + " concurrency limit reached after " + acquireTimeoutMs + "ms wait", providerName);
    }

    /**
     * Held for the duration of one provider call.
     */
    public final class Permit implements AutoCloseable {
        private final Semaphore session;
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit(Semaphore session) {
            this.session = session;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                global.release();
                session.release();
            }
        }
    }
}
