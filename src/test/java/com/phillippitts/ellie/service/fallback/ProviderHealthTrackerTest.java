package com.phillippitts.ellie.service.fallback;

import com.phillippitts.ellie.config.properties.FallbackProperties;
import com.phillippitts.ellie.service.fallback.ProviderHealthTracker.CircuitState;
import com.phillippitts.ellie.service.fallback.event.FallbackUsedEvent;
import com.phillippitts.ellie.service.provider.ProviderNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderHealthTrackerTest {

    private static final String GROQ = ProviderNames.GROQ;

    private Instant now = Instant.parse("2024-01-01T00:00:00Z");
    private ProviderHealthTracker tracker;

    @BeforeEach
    void setUp() {
        FallbackProperties props = new FallbackProperties();
        props.setFailureThreshold(3);
        props.setOpenTimeoutSeconds(30);
        Clock clock = new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return now;
            }
        };
        tracker = new ProviderHealthTracker(props, clock);
    }

    @Test
    void opensAfterConsecutiveFailures() {
        fail(2);
        assertThat(tracker.getState(GROQ)).isEqualTo(CircuitState.CLOSED);

        fail(1);
        assertThat(tracker.getState(GROQ)).isEqualTo(CircuitState.OPEN);
        assertThat(tracker.isAvailable(GROQ)).isFalse();
        assertThat(tracker.providerStatuses().get(GROQ).available()).isFalse();
    }

    @Test
    void successResetsFailureCount() {
        fail(2);
        tracker.recordSuccess(GROQ, 100);
        fail(2);
        assertThat(tracker.getState(GROQ)).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void admitsTrialCallAfterTimeoutAndClosesOnSuccess() {
        fail(3);
        now = now.plus(Duration.ofSeconds(31));

        assertThat(tracker.isAvailable(GROQ)).isTrue();
        assertThat(tracker.getState(GROQ)).isEqualTo(CircuitState.HALF_OPEN);

        tracker.recordSuccess(GROQ, 50);
        assertThat(tracker.getState(GROQ)).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void failedTrialCallReopens() {
        fail(3);
        now = now.plus(Duration.ofSeconds(31));
        tracker.isAvailable(GROQ);

        fail(1);
        assertThat(tracker.getState(GROQ)).isEqualTo(CircuitState.OPEN);
        assertThat(tracker.providerStatuses().get(GROQ).openUntil()).isEqualTo(now.plusSeconds(30));
    }

    @Test
    void countsFallbacksPerReason() {
        tracker.onFallbackUsed(new FallbackUsedEvent("s", FallbackReason.GENERATION_FAILED, GROQ, null));
        tracker.onFallbackUsed(new FallbackUsedEvent("s", FallbackReason.GENERATION_FAILED, GROQ, null));
        tracker.onFallbackUsed(new FallbackUsedEvent("s", FallbackReason.SYNTHESIS_FAILED, null, null));

        FallbackStats stats = tracker.stats();
        assertThat(stats.totalFallbacks()).isEqualTo(3);
        assertThat(stats.fallbacksByReason()).containsEntry(FallbackReason.GENERATION_FAILED, 2L)
                .containsEntry(FallbackReason.TRANSCRIPTION_FAILED, 0L);
        assertThat(stats.providers()).containsKeys(ProviderNames.UPSTREAM.toArray(new String[0]));
    }

    @Test
    void tracksAverageLatency() {
        tracker.recordSuccess(GROQ, 100);
        tracker.recordSuccess(GROQ, 300);
        assertThat(tracker.providerStatuses().get(GROQ).averageResponseTimeMs()).isEqualTo(200.0);
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            tracker.recordFailure(GROQ, 10, new RuntimeException("boom"));
        }
    }
}
