package com.phillippitts.ellie.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for voice and text turns.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>end-to-end turn latency by outcome</li>
 *   <li>provider call latency and failures by provider</li>
 *   <li>cache hits and misses by cache</li>
 *   <li>fallback replies by reason</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class OrchestrationMetrics {

    private static final String METRIC_PREFIX = "ellie";

    private final MeterRegistry registry;

    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "response", "fallback" or "error"
     */
    public void recordTurn(String channel, String outcome, long durationMillis) {
        Timer.builder(METRIC_PREFIX + ".turn.latency")
                .description("End-to-end time to answer a user turn")
                .tag("channel", channel)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationMillis, TimeUnit.MILLISECONDS);
    }

    public void recordProviderLatency(String provider, long durationMillis) {
        Timer.builder(METRIC_PREFIX + ".provider.latency")
                .description("Time taken by a successful provider call")
                .tag("provider", provider)
                .register(registry)
                .record(durationMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * @param reason failure reason (timeout, unavailable, error)
     */
    public void incrementProviderFailure(String provider, String reason) {
        Counter.builder(METRIC_PREFIX + ".provider.failure")
                .description("Number of failed provider calls")
                .tag("provider", provider)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementCacheHit(String cache) {
        Counter.builder(METRIC_PREFIX + ".cache.hit")
                .description("Number of response cache hits")
                .tag("cache", cache)
                .register(registry)
                .increment();
    }

    public void incrementCacheMiss(String cache) {
        Counter.builder(METRIC_PREFIX + ".cache.miss")
                .description("Number of response cache misses")
                .tag("cache", cache)
                .register(registry)
                .increment();
    }

    public void incrementFallback(String reason) {
        Counter.builder(METRIC_PREFIX + ".fallback.used")
                .description("Number of turns answered by the fallback service")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
