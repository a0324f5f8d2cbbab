package com.phillippitts.ellie.service.orchestration;

import com.phillippitts.ellie.config.properties.FallbackProperties;
import com.phillippitts.ellie.exception.ProviderException;
import com.phillippitts.ellie.exception.ProviderTimeoutException;
import com.phillippitts.ellie.exception.ProviderUnavailableException;
import com.phillippitts.ellie.service.fallback.ProviderHealthTracker;
import com.phillippitts.ellie.service.metrics.OrchestrationMetrics;
import com.phillippitts.ellie.service.provider.ConcurrencyGuard;
import com.phillippitts.ellie.service.provider.ProviderNames;
import com.phillippitts.ellie.service.provider.event.ProviderFailureEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageExecutorTest {

    private final List<Object> events = new CopyOnWriteArrayList<>();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private ProviderHealthTracker health;
    private ExecutorService pool;
    private ConcurrencyGuard guard;

    @BeforeEach
    void setUp() {
        FallbackProperties props = new FallbackProperties();
        props.setFailureThreshold(2);
        health = new ProviderHealthTracker(props);
        pool = Executors.newCachedThreadPool();
        guard = new ConcurrencyGuard(ProviderNames.GROQ, 4, 2, 50, events::add);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private StageExecutor stages() {
        return new StageExecutor(pool, health, new OrchestrationMetrics(registry), events::add);
    }

    @Test
    void returnsResultAndRecordsSuccess() {
        String result = stages().call(guard, "s1", 1_000, () -> "ok");

        assertThat(result).isEqualTo("ok");
        assertThat(health.providerStatuses().get(ProviderNames.GROQ).consecutiveFailures()).isZero();
        assertThat(registry.find("ellie.provider.latency").tag("provider", ProviderNames.GROQ).timer())
                .isNotNull();
    }

    @Test
    void failureIsReportedAndCounted() {
        assertThatThrownBy(() -> stages().call(guard, "s1", 1_000, () -> {
            throw new ProviderException("bad gateway", ProviderNames.GROQ);
        })).isInstanceOf(ProviderException.class).hasMessageContaining("bad gateway");

        assertThat(events).hasOnlyElementsOfType(ProviderFailureEvent.class).hasSize(1);
        assertThat(health.providerStatuses().get(ProviderNames.GROQ).consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void unexpectedExceptionIsWrapped() {
        assertThatThrownBy(() -> stages().call(guard, "s1", 1_000, () -> {
            throw new IllegalStateException("bug");
        })).isInstanceOf(ProviderException.class).hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void slowCallTimesOutAndStillReleasesPermitWhenItFinishes() throws Exception {
        CountDownLatch release = new CountDownLatch(1);

        assertThatThrownBy(() -> stages().call(guard, "s1", 50, () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        })).isInstanceOf(ProviderTimeoutException.class);

        assertThat(guard.availableGlobalPermits()).isEqualTo(3);
        release.countDown();
        long deadline = System.currentTimeMillis() + 2_000;
        while (guard.availableGlobalPermits() != 4 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(guard.availableGlobalPermits()).isEqualTo(4);
    }

    @Test
    void openCircuitSkipsTheCall() {
        AtomicInteger calls = new AtomicInteger();
        for (int i = 0; i < 2; i++) {
            try {
                stages().call(guard, "s1", 1_000, () -> {
                    calls.incrementAndGet();
                    throw new ProviderException("down", ProviderNames.GROQ);
                });
            } catch (ProviderException expected) {
                // counted toward the threshold
            }
        }

        assertThatThrownBy(() -> stages().call(guard, "s1", 1_000, () -> {
            calls.incrementAndGet();
            return "never";
        })).isInstanceOf(ProviderUnavailableException.class).hasMessageContaining("Circuit open");
        assertThat(calls).hasValue(2);
    }

    @Test
    void saturatedExecutorShedsAndReturnsPermits() {
        StageExecutor rejecting = new StageExecutor(task -> {
            throw new RejectedExecutionException("full");
        }, health, new OrchestrationMetrics(registry), events::add);

        assertThatThrownBy(() -> rejecting.call(guard, "s1", 1_000, () -> "x"))
                .isInstanceOf(ProviderUnavailableException.class);
        assertThat(guard.availableGlobalPermits()).isEqualTo(4);
    }
}
