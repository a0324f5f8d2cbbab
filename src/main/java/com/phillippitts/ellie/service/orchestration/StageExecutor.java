package com.phillippitts.ellie.service.orchestration;

import com.phillippitts.ellie.exception.ProviderException;
import com.phillippitts.ellie.exception.ProviderExceptionBuilder;
import com.phillippitts.ellie.exception.ProviderTimeoutException;
import com.phillippitts.ellie.exception.ProviderUnavailableException;
import com.phillippitts.ellie.service.fallback.ProviderHealthTracker;
import com.phillippitts.ellie.service.metrics.OrchestrationMetrics;
import com.phillippitts.ellie.service.provider.ConcurrencyGuard;
import com.phillippitts.ellie.service.provider.event.ProviderFailureEvent;
import com.phillippitts.ellie.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one provider call under the stage's protections.
 *
 * <p>In order: skip when the provider's circuit is open, take concurrency permits, run the call
 * on the provider executor, wait at most the stage timeout. Every failure comes out as a
 * {@link ProviderException}. A call that outlives its timeout keeps running to completion (and keeps
 * its permits until then); only the caller stops waiting.
 */
public class StageExecutor {

    private static final Logger LOG = LogManager.getLogger(StageExecutor.class);

    private final Executor providerExecutor;
    private final ProviderHealthTracker health;
    private final OrchestrationMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public StageExecutor(Executor providerExecutor,
                         ProviderHealthTracker health,
                         OrchestrationMetrics metrics,
                         ApplicationEventPublisher publisher) {
        this.providerExecutor = Objects.requireNonNull(providerExecutor, "providerExecutor");
        this.health = Objects.requireNonNull(health, "health");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * @param guard     concurrency caps of the provider; its name identifies the provider
     * @param sessionId session making the call
     * @param timeoutMs stage timeout
     * @param call      blocking provider call
     * @throws ProviderUnavailableException when the call was shed (open circuit, capacity, saturated executor)
     * @throws ProviderTimeoutException     when the call did not finish in time
     * @throws ProviderException            when the call failed
     */
    public <T> T call(ConcurrencyGuard guard, String sessionId, long timeoutMs, Supplier<T> call) {
        String provider = guard.getProviderName();
        if (!health.isAvailable(provider)) {
            LOG.debug("Skipping {}: circuit open", provider);
            metrics.incrementProviderFailure(provider, "circuit-open");
            throw new ProviderUnavailableException("Circuit open", provider);
        }

        ConcurrencyGuard.Permit permit;
        try {
            permit = guard.acquire(sessionId);
        } catch (ProviderUnavailableException e) {
            metrics.incrementProviderFailure(provider, "capacity");
            throw e;
        }

        long t0 = System.nanoTime();
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(call, providerExecutor);
        } catch (RejectedExecutionException e) {
            permit.close();
            metrics.incrementProviderFailure(provider, "capacity");
            throw new ProviderUnavailableException("Provider executor saturated", provider, e);
        }
        future.whenComplete((result, error) -> permit.close());

        try {
            T result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            long ms = TimeUtils.elapsedMillis(t0);
            health.recordSuccess(provider, ms);
            metrics.recordProviderLatency(provider, ms);
            return result;
        } catch (TimeoutException e) {
            ProviderException timeout = ProviderExceptionBuilder.create("Provider call timed out")
                    .provider(provider)
                    .timeout(timeoutMs)
                    .build();
            throw failed(provider, timeout, "timeout", TimeUtils.elapsedMillis(t0));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            ProviderException failure = cause instanceof ProviderException pe
                    ? pe
                    : new ProviderException("Unexpected provider error", provider, cause);
            throw failed(provider, failure, "error", TimeUtils.elapsedMillis(t0));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException("Interrupted while waiting for provider", provider, e);
        }
    }

    private ProviderException failed(String provider, ProviderException failure, String reason, long durationMs) {
        LOG.warn("Provider {} failed after {} ms: {}", provider, durationMs, failure.getMessage());
        health.recordFailure(provider, durationMs, failure);
        metrics.incrementProviderFailure(provider, reason);
        publisher.publishEvent(new ProviderFailureEvent(provider, Instant.now(), failure.getMessage(), failure,
                Map.of("reason", reason, "durationMs", String.valueOf(durationMs))));
        return failure;
    }
}
