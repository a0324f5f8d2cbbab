package com.phillippitts.ellie.service.orchestration;

import com.phillippitts.ellie.config.properties.ClassifierProperties;
import com.phillippitts.ellie.config.properties.FallbackProperties;
import com.phillippitts.ellie.domain.ComplexityClass;
import com.phillippitts.ellie.service.fallback.ProviderHealthTracker;
import com.phillippitts.ellie.service.metrics.OrchestrationMetrics;
import com.phillippitts.ellie.service.provider.ConcurrencyGuard;
import com.phillippitts.ellie.service.provider.GenerationRequest;
import com.phillippitts.ellie.service.provider.ProviderNames;
import com.phillippitts.ellie.testutil.FakeProviders;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderRouterTest {

    private FakeProviders.Generation fast;
    private FakeProviders.Generation accurate;
    private ProviderRouter router;

    @BeforeEach
    void setUp() {
        fast = new FakeProviders.Generation(ProviderNames.GROQ, "fast answer");
        accurate = new FakeProviders.Generation(ProviderNames.OPENAI_CHAT, "accurate answer");
        StageExecutor stages = new StageExecutor(Runnable::run, new ProviderHealthTracker(new FallbackProperties()),
                new OrchestrationMetrics(new SimpleMeterRegistry()), event -> { });
        router = new ProviderRouter(
                new ProviderRouter.Route(fast, new ConcurrencyGuard(ProviderNames.GROQ, 4, 2, 50, null)),
                new ProviderRouter.Route(accurate, new ConcurrencyGuard(ProviderNames.OPENAI_CHAT, 4, 2, 50, null)),
                stages, new ClassifierProperties(), 1_000);
    }

    @Test
    void simpleTurnsGoToFastProvider() {
        RoutingResult result = router.route("s", request("hello", ComplexityClass.SIMPLE));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.provider()).isEqualTo(ProviderNames.GROQ);
        assertThat(accurate.callCount()).isZero();
    }

    @Test
    void complexTurnsGoToAccurateProvider() {
        RoutingResult result = router.route("s", request("litigation question", ComplexityClass.COMPLEX));

        assertThat(result.text()).isEqualTo("accurate answer");
        assertThat(fast.callCount()).isZero();
    }

    @Test
    void longModerateLegalQuestionPrefersAccurate() {
        String question = "I signed a contract with a contractor last spring and he never finished the work";
        assertThat(router.prefersAccurate(ComplexityClass.MODERATE, question)).isTrue();
        assertThat(router.prefersAccurate(ComplexityClass.MODERATE, "contract?")).isFalse();
        assertThat(router.prefersAccurate(ComplexityClass.SIMPLE, question)).isFalse();
    }

    @Test
    void fallsThroughToSecondProvider() {
        fast.fails();

        RoutingResult result = router.route("s", request("what are your hours", ComplexityClass.MODERATE));

        assertThat(result.provider()).isEqualTo(ProviderNames.OPENAI_CHAT);
        assertThat(result.lastFailedProvider()).isEqualTo(ProviderNames.GROQ);
        assertThat(fast.callCount()).isEqualTo(1);
    }

    @Test
    void exhaustedWhenBothFail() {
        fast.fails();
        accurate.fails();

        RoutingResult result = router.route("s", request("what are your hours", ComplexityClass.MODERATE));

        assertThat(result.succeeded()).isFalse();
        assertThat(result.allUnavailable()).isFalse();
        assertThat(result.lastFailedProvider()).isEqualTo(ProviderNames.OPENAI_CHAT);
    }

    @Test
    void unconfiguredProvidersCountAsUnavailable() {
        fast.unconfigured();
        accurate.unconfigured();

        RoutingResult result = router.route("s", request("hi", ComplexityClass.SIMPLE));

        assertThat(result.succeeded()).isFalse();
        assertThat(result.allUnavailable()).isTrue();
        assertThat(fast.callCount()).isZero();
    }

    private static GenerationRequest request(String text, ComplexityClass complexity) {
        return new GenerationRequest(text, List.of(), "system", complexity);
    }
}
