package com.phillippitts.ellie.service.health;

import com.phillippitts.ellie.config.properties.FallbackProperties;
import com.phillippitts.ellie.service.fallback.ProviderHealthTracker;
import com.phillippitts.ellie.service.provider.ProviderNames;
import com.phillippitts.ellie.testutil.FakeProviders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderHealthIndicatorTest {

    private FakeProviders.Generation fast;
    private FakeProviders.Generation accurate;
    private FakeProviders.Synthesis tts;
    private ProviderHealthTracker tracker;

    @BeforeEach
    void setUp() {
        fast = new FakeProviders.Generation(ProviderNames.GROQ, "x");
        accurate = new FakeProviders.Generation(ProviderNames.OPENAI_CHAT, "y");
        tts = new FakeProviders.Synthesis();
        FallbackProperties props = new FallbackProperties();
        props.setFailureThreshold(1);
        tracker = new ProviderHealthTracker(props);
    }

    private Health health() {
        return new ProviderHealthIndicator(new FakeProviders.Transcription("hi"), tts, List.of(fast, accurate),
                tracker).health();
    }

    @Test
    void upWhenEveryStageHasAReadyProvider() {
        Health health = health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry(ProviderNames.GROQ, "ready")
                .containsEntry(ProviderNames.TTS, "ready");
    }

    @Test
    void oneGenerationProviderIsEnough() {
        fast.unconfigured();
        Health health = health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry(ProviderNames.GROQ, "unconfigured");
    }

    @Test
    void degradedWhenSynthesisCircuitIsOpen() {
        tracker.recordFailure(ProviderNames.TTS, 10, new RuntimeException("down"));

        Health health = health();

        assertThat(health.getStatus().getCode()).isEqualTo(ProviderHealthIndicator.DEGRADED);
        assertThat(health.getDetails()).containsEntry(ProviderNames.TTS, "circuit-open");
    }

    @Test
    void degradedWhenNoGenerationProviderIsReady() {
        fast.unconfigured();
        accurate.unconfigured();

        assertThat(health().getStatus().getCode()).isEqualTo(ProviderHealthIndicator.DEGRADED);
    }
}
