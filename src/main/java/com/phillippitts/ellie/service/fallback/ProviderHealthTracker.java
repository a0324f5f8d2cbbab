package com.phillippitts.ellie.service.fallback;

import com.phillippitts.ellie.config.properties.FallbackProperties;
import com.phillippitts.ellie.service.fallback.event.FallbackUsedEvent;
import com.phillippitts.ellie.service.provider.ProviderNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-provider circuit breaker that sheds load from failing upstreams.
 *
 * <p>State model:
 * <ul>
 *   <li>CLOSED: calls pass; {@code failureThreshold} consecutive failures open the circuit.</li>
 *   <li>OPEN: calls are skipped without contacting the provider until {@code openTimeoutSeconds} pass.</li>
 *   <li>HALF_OPEN: calls pass again; one success closes the circuit, one failure reopens it.</li>
 * </ul>
 *
 * <p>Also counts fallback replies per reason for the monitoring endpoint.
 */
@Component
public class ProviderHealthTracker {

    private static final Logger LOG = LogManager.getLogger(ProviderHealthTracker.class);

    public enum CircuitState { CLOSED, OPEN, HALF_OPEN }

    private final FallbackProperties props;
    private final Clock clock;

    private final ConcurrentMap<String, Circuit> circuits = new ConcurrentHashMap<>();
    private final Map<FallbackReason, AtomicLong> fallbackCounts = new EnumMap<>(FallbackReason.class);

    @Autowired
    public ProviderHealthTracker(FallbackProperties props) {
        this(props, Clock.systemUTC());
    }

    ProviderHealthTracker(FallbackProperties props, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (String provider : ProviderNames.UPSTREAM) {
            circuits.put(provider, new Circuit());
        }
        for (FallbackReason reason : FallbackReason.values()) {
            fallbackCounts.put(reason, new AtomicLong());
        }
        LOG.info("Provider health tracking initialized for providers={}", circuits.keySet());
    }

    /**
     * Returns whether a call to the provider should be attempted. An open circuit whose timeout
     * has elapsed moves to HALF_OPEN and admits the call.
     */
    public boolean isAvailable(String provider) {
        Circuit circuit = circuit(provider);
        circuit.lock.lock();
        try {
            if (circuit.state != CircuitState.OPEN) {
                return true;
            }
            if (clock.instant().isBefore(circuit.openUntil)) {
                return false;
            }
            circuit.state = CircuitState.HALF_OPEN;
            circuit.openUntil = null;
            LOG.info("Provider {} circuit half-open; admitting trial call", provider);
            return true;
        } finally {
            circuit.lock.unlock();
        }
    }

    public void recordSuccess(String provider, long durationMs) {
        Circuit circuit = circuit(provider);
        circuit.lock.lock();
        try {
            CircuitState previous = circuit.state;
            circuit.consecutiveFailures = 0;
            circuit.state = CircuitState.CLOSED;
            circuit.openUntil = null;
            circuit.record(durationMs, clock.instant());
            if (previous != CircuitState.CLOSED) {
                LOG.info("Provider {} recovered; circuit closed", provider);
            }
        } finally {
            circuit.lock.unlock();
        }
    }

    public void recordFailure(String provider, long durationMs, Throwable cause) {
        Circuit circuit = circuit(provider);
        circuit.lock.lock();
        try {
            Instant now = clock.instant();
            circuit.consecutiveFailures++;
            circuit.record(durationMs, now);
            boolean trip = circuit.state == CircuitState.HALF_OPEN
                    || (circuit.state == CircuitState.CLOSED
                        && circuit.consecutiveFailures >= props.getFailureThreshold());
            if (trip) {
                circuit.state = CircuitState.OPEN;
                circuit.openUntil = now.plus(Duration.ofSeconds(props.getOpenTimeoutSeconds()));
                LOG.error("Provider {} circuit opened after {} consecutive failures; retry after {} ({})",
                        provider, circuit.consecutiveFailures, circuit.openUntil,
                        cause != null ? cause.toString() : "no cause");
            }
        } finally {
            circuit.lock.unlock();
        }
    }

    @EventListener
    public void onFallbackUsed(FallbackUsedEvent event) {
        fallbackCounts.get(event.reason()).incrementAndGet();
    }

    /** Visible for tests */
    CircuitState getState(String provider) {
        return circuit(provider).state;
    }

    public Map<String, ProviderStatus> providerStatuses() {
        Map<String, ProviderStatus> snapshot = new TreeMap<>();
        circuits.forEach((name, circuit) -> snapshot.put(name, circuit.snapshot()));
        return snapshot;
    }

    public FallbackStats stats() {
        Map<FallbackReason, Long> byReason = new EnumMap<>(FallbackReason.class);
        long total = 0;
        for (Map.Entry<FallbackReason, AtomicLong> entry : fallbackCounts.entrySet()) {
            long count = entry.getValue().get();
            byReason.put(entry.getKey(), count);
            total += count;
        }
        return new FallbackStats(total, byReason, providerStatuses());
    }

    @Scheduled(fixedRate = 60_000)
    void logHealthSummary() {
        StringBuilder sb = new StringBuilder("Provider circuits: ");
        circuits.forEach((name, circuit) -> sb.append(name).append('=').append(circuit.state).append(' '));
        LOG.info(sb.toString().trim());
    }

    private Circuit circuit(String provider) {
        return circuits.computeIfAbsent(provider, p -> new Circuit());
    }

    /** Mutable circuit state guarded by its own lock. */
    private static final class Circuit {
        private static final double EMA_WEIGHT = 0.5;

        private final ReentrantLock lock = new ReentrantLock();
        private volatile CircuitState state = CircuitState.CLOSED;
        private int consecutiveFailures;
        private double averageResponseTimeMs;
        private Instant lastChecked;
        private Instant openUntil;

        private void record(long durationMs, Instant now) {
            averageResponseTimeMs = lastChecked == null
                    ? durationMs
                    : averageResponseTimeMs * (1 - EMA_WEIGHT) + durationMs * EMA_WEIGHT;
            lastChecked = now;
        }

        private ProviderStatus snapshot() {
            lock.lock();
            try {
                return new ProviderStatus(state, consecutiveFailures, averageResponseTimeMs, lastChecked, openUntil);
            } finally {
                lock.unlock();
            }
        }
    }
}
