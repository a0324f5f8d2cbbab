package com.phillippitts.ellie.service.orchestration;

import com.phillippitts.ellie.config.properties.AudioValidationProperties;
import com.phillippitts.ellie.config.properties.CacheProperties;
import com.phillippitts.ellie.config.properties.ClassifierProperties;
import com.phillippitts.ellie.config.properties.FallbackProperties;
import com.phillippitts.ellie.config.properties.OrchestrationProperties;
import com.phillippitts.ellie.config.properties.SessionProperties;
import com.phillippitts.ellie.domain.AudioInput;
import com.phillippitts.ellie.domain.AudioResponse;
import com.phillippitts.ellie.domain.MessageRole;
import com.phillippitts.ellie.domain.TextReply;
import com.phillippitts.ellie.exception.EllieException;
import com.phillippitts.ellie.exception.ErrorCode;
import com.phillippitts.ellie.service.cache.CacheFingerprints;
import com.phillippitts.ellie.service.cache.InMemoryResponseCache;
import com.phillippitts.ellie.service.classify.HeuristicComplexityClassifier;
import com.phillippitts.ellie.service.classify.LegalLexicon;
import com.phillippitts.ellie.service.fallback.CannedFallbackService;
import com.phillippitts.ellie.service.fallback.FallbackReason;
import com.phillippitts.ellie.service.fallback.FallbackService;
import com.phillippitts.ellie.service.fallback.ProviderHealthTracker;
import com.phillippitts.ellie.service.fallback.event.FallbackUsedEvent;
import com.phillippitts.ellie.service.metrics.OrchestrationMetrics;
import com.phillippitts.ellie.service.orchestration.event.TurnCompletedEvent;
import com.phillippitts.ellie.service.provider.ConcurrencyGuard;
import com.phillippitts.ellie.service.provider.ProviderNames;
import com.phillippitts.ellie.service.session.SessionEndedEvent;
import com.phillippitts.ellie.service.session.SessionRegistry;
import com.phillippitts.ellie.testutil.FakeProviders;
import com.phillippitts.ellie.testutil.RecordingTurnSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DefaultResponseOrchestratorTest {

    private static final AudioInput AUDIO = new AudioInput(new byte[]{1, 2, 3, 4}, "webm", 0);

    private final List<Object> events = new CopyOnWriteArrayList<>();
    private final ApplicationEventPublisher publisher = events::add;

    private FakeProviders.Transcription stt;
    private FakeProviders.Generation fast;
    private FakeProviders.Generation accurate;
    private FakeProviders.Synthesis tts;
    private InMemoryResponseCache<String> textCache;
    private InMemoryResponseCache<byte[]> audioCache;
    private CacheProperties cacheProperties;
    private SessionRegistry sessions;
    private FallbackService fallback;
    private Executor turnExecutor;

    @BeforeEach
    void setUp() {
        stt = new FakeProviders.Transcription("What are your office hours?");
        fast = new FakeProviders.Generation(ProviderNames.GROQ, "We are open nine to five.");
        accurate = new FakeProviders.Generation(ProviderNames.OPENAI_CHAT, "Our office is open weekdays.");
        tts = new FakeProviders.Synthesis();
        textCache = new InMemoryResponseCache<>("text", 100);
        audioCache = new InMemoryResponseCache<>("audio", 100);
        cacheProperties = new CacheProperties();
        sessions = new SessionRegistry(new SessionProperties(), publisher);
        fallback = new CannedFallbackService();
        turnExecutor = Runnable::run;
    }

    private DefaultResponseOrchestrator orchestrator() {
        OrchestrationProperties props = OrchestrationProperties.defaults();
        ProviderHealthTracker health = new ProviderHealthTracker(new FallbackProperties());
        OrchestrationMetrics metrics = new OrchestrationMetrics(new SimpleMeterRegistry());
        StageExecutor stages = new StageExecutor(Runnable::run, health, metrics, publisher);
        ProviderRouter router = new ProviderRouter(
                new ProviderRouter.Route(fast, guard(ProviderNames.GROQ)),
                new ProviderRouter.Route(accurate, guard(ProviderNames.OPENAI_CHAT)),
                stages, new ClassifierProperties(), props.getGenerationTimeoutMs());
        return ResponseOrchestratorBuilder.builder()
                .validator(new com.phillippitts.ellie.service.validation.AudioValidator(new AudioValidationProperties()))
                .transcription(stt, guard(ProviderNames.WHISPER))
                .classifier(new HeuristicComplexityClassifier(new ClassifierProperties()))
                .router(router)
                .synthesis(tts, guard(ProviderNames.TTS))
                .caches(textCache, audioCache, cacheProperties)
                .fallbackService(fallback)
                .sessions(sessions)
                .stages(stages)
                .turnExecutor(turnExecutor)
                .properties(props)
                .metrics(metrics)
                .publisher(publisher)
                .build();
    }

    private ConcurrencyGuard guard(String name) {
        return new ConcurrencyGuard(name, 8, 2, 100, publisher);
    }

    @Test
    void voiceTurnEmitsStatusesThenOneResponse() {
        RecordingTurnSink sink = new RecordingTurnSink();

        orchestrator().handleVoiceInput("s1", AUDIO, sink).join();

        assertThat(sink.events).containsExactly(
                "status:PROCESSING:transcribing",
                "status:PROCESSING:generating",
                "status:PROCESSING:synthesizing",
                "status:SPEAKING:response ready",
                "ai-response");
        AudioResponse response = sink.onlyResponse();
        assertThat(response.text()).isEqualTo("We are open nine to five.");
        assertThat(response.transcript()).isNotBlank();
        assertThat(response.provider()).isEqualTo(ProviderNames.GROQ);
        assertThat(response.fallback()).isFalse();
        assertThat(new String(response.audio())).isEqualTo("mp3:We are open nine to five.");

        assertThat(sessions.find("s1")).get().satisfies(session ->
                assertThat(session.history()).extracting(m -> m.role())
                        .containsExactly(MessageRole.USER, MessageRole.ASSISTANT));
        assertThat(events).filteredOn(TurnCompletedEvent.class::isInstance).singleElement()
                .satisfies(e -> assertThat(((TurnCompletedEvent) e).outcome()).isEqualTo("response"));
    }

    @Test
    void repeatedQuestionIsServedFromCaches() {
        DefaultResponseOrchestrator orchestrator = orchestrator();
        orchestrator.handleVoiceInput("s1", AUDIO, new RecordingTurnSink()).join();

        RecordingTurnSink second = new RecordingTurnSink();
        orchestrator.handleVoiceInput("s2", AUDIO, second).join();

        AudioResponse response = second.onlyResponse();
        assertThat(response.cached()).isTrue();
        assertThat(response.provider()).isEqualTo(ProviderNames.CACHE);
        assertThat(second.events).doesNotContain("status:PROCESSING:generating");
        assertThat(fast.callCount()).isEqualTo(1);
        assertThat(tts.calls).hasValue(1);
    }

    @Test
    void disabledCacheAlwaysGenerates() {
        cacheProperties.setEnabled(false);
        DefaultResponseOrchestrator orchestrator = orchestrator();

        orchestrator.handleVoiceInput("s1", AUDIO, new RecordingTurnSink()).join();
        orchestrator.handleVoiceInput("s1", AUDIO, new RecordingTurnSink()).join();

        assertThat(fast.callCount()).isEqualTo(2);
        assertThat(textCache.stats().size()).isZero();
    }

    @Test
    void fastProviderOutageIsAnsweredByAccurateProvider() {
        fast.fails();
        RecordingTurnSink sink = new RecordingTurnSink();

        orchestrator().handleVoiceInput("s1", AUDIO, sink).join();

        assertThat(sink.onlyResponse().provider()).isEqualTo(ProviderNames.OPENAI_CHAT);
    }

    @Test
    void allGenerationProvidersDownYieldsFallbackReply() {
        fast.fails();
        accurate.fails();
        RecordingTurnSink sink = new RecordingTurnSink();

        orchestrator().handleVoiceInput("s1", AUDIO, sink).join();

        AudioResponse response = sink.onlyResponse();
        assertThat(response.fallback()).isTrue();
        assertThat(response.provider()).isEqualTo(ProviderNames.FALLBACK);
        assertThat(events).filteredOn(FallbackUsedEvent.class::isInstance)
                .extracting(e -> ((FallbackUsedEvent) e).reason())
                .containsExactly(FallbackReason.GENERATION_FAILED);
        assertThat(textCache.get(CacheFingerprints.text("What are your office hours?"))).isEmpty();
    }

    @Test
    void transcriptionFailureYieldsFallbackReplyNotError() {
        stt.fails();
        RecordingTurnSink sink = new RecordingTurnSink();

        orchestrator().handleVoiceInput("s1", AUDIO, sink).join();

        assertThat(sink.onlyResponse().fallback()).isTrue();
        assertThat(sink.onlyResponse().transcript()).isNull();
        assertThat(fast.callCount()).isZero();
        assertThat(events).filteredOn(FallbackUsedEvent.class::isInstance)
                .extracting(e -> ((FallbackUsedEvent) e).reason())
                .containsExactly(FallbackReason.TRANSCRIPTION_FAILED);
    }

    @Test
    void silenceYieldsFallbackReply() {
        stt.hears("   ");
        RecordingTurnSink sink = new RecordingTurnSink();

        orchestrator().handleVoiceInput("s1", AUDIO, sink).join();

        assertThat(sink.onlyResponse().fallback()).isTrue();
        assertThat(sessions.find("s1")).get().satisfies(s -> assertThat(s.history()).isEmpty());
    }

    @Test
    void synthesisFailureKeepsTextAndPlaysCue() {
        tts.fails();
        RecordingTurnSink sink = new RecordingTurnSink();

        orchestrator().handleVoiceInput("s1", AUDIO, sink).join();

        AudioResponse response = sink.onlyResponse();
        assertThat(response.text()).isEqualTo("We are open nine to five.");
        assertThat(response.fallback()).isFalse();
        assertThat(response.audio()).isEqualTo(fallback.audioCue());
        assertThat(events).filteredOn(FallbackUsedEvent.class::isInstance)
                .extracting(e -> ((FallbackUsedEvent) e).reason())
                .containsExactly(FallbackReason.SYNTHESIS_FAILED);
    }

    @Test
    void unconfiguredSynthesisIsNeverCalled() {
        tts.unconfigured();
        RecordingTurnSink sink = new RecordingTurnSink();

        orchestrator().handleVoiceInput("s1", AUDIO, sink).join();

        assertThat(tts.calls).hasValue(0);
        assertThat(sink.onlyResponse().audio()).isEqualTo(fallback.audioCue());
    }

    @Test
    void invalidAudioEndsTurnWithSingleError() {
        RecordingTurnSink sink = new RecordingTurnSink();

        orchestrator().handleVoiceInput("s1", new AudioInput(new byte[]{1}, "exe", 0), sink).join();

        assertThat(sink.events).containsExactly("error:" + ErrorCode.INVALID_AUDIO_FORMAT);
        assertThat(stt.calls).hasValue(0);
    }

    @Test
    void fallbackFailureEndsTurnWithProcessingError() {
        stt.fails();
        fallback = mock(FallbackService.class);
        when(fallback.getFallbackResponse(any())).thenThrow(new IllegalStateException("broken"));
        RecordingTurnSink sink = new RecordingTurnSink();

        orchestrator().handleVoiceInput("s1", AUDIO, sink).join();

        assertThat(sink.terminalCount()).isEqualTo(1);
        assertThat(sink.errors).extracting(ErrorResponse::code).containsExactly(ErrorCode.AUDIO_PROCESSING_FAILED);
    }

    @Test
    void disconnectedClientDoesNotStopTheTurn() {
        RecordingTurnSink closed = new RecordingTurnSink() {
            @Override
            public void response(AudioResponse response) {
                throw new IllegalStateException("session closed");
            }
        };

        orchestrator().handleVoiceInput("s1", AUDIO, closed).join();

        assertThat(textCache.get(CacheFingerprints.text("What are your office hours?")))
                .contains("We are open nine to five.");
        assertThat(events).filteredOn(TurnCompletedEvent.class::isInstance).hasSize(1);
    }

    @Test
    void saturatedTurnExecutorRejectsWithServiceUnavailable() {
        turnExecutor = task -> {
            throw new RejectedExecutionException("full");
        };
        RecordingTurnSink sink = new RecordingTurnSink();

        orchestrator().handleVoiceInput("s1", AUDIO, sink).join();

        assertThat(sink.errors).extracting(ErrorResponse::code).containsExactly(ErrorCode.SERVICE_UNAVAILABLE);
    }

    @Test
    void textTurnRecordsBothMessages() {
        TextReply reply = orchestrator().handleTextInput("t1", "  What are your office hours?  ");

        assertThat(reply.response()).isEqualTo("We are open nine to five.");
        assertThat(reply.provider()).isEqualTo(ProviderNames.GROQ);
        assertThat(reply.fallback()).isFalse();
        assertThat(sessions.find("t1")).get().satisfies(s ->
                assertThat(s.history()).extracting(m -> m.text())
                        .containsExactly("What are your office hours?", "We are open nine to five."));
        assertThat(stt.calls).hasValue(0);
        assertThat(tts.calls).hasValue(0);
    }

    @Test
    void blankTextIsRejected() {
        assertThatThrownBy(() -> orchestrator().handleTextInput("t1", "  "))
                .isInstanceOf(EllieException.class)
                .satisfies(e -> assertThat(((EllieException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));
    }

    @Test
    void generationSeesPriorTurnsAsHistory() {
        DefaultResponseOrchestrator orchestrator = orchestrator();
        orchestrator.handleTextInput("t1", "Do you handle divorces?");
        orchestrator.handleTextInput("t1", "How long does it usually take?");

        assertThat(fast.requests.get(fast.requests.size() - 1).history()).hasSize(2);
    }

    @Test
    void legalReplyGetsDisclaimer() {
        assertThat(DefaultResponseOrchestrator.withDisclaimer("Can I sue my landlord?", "Possibly."))
                .endsWith(LegalLexicon.DISCLAIMER);
        assertThat(DefaultResponseOrchestrator.withDisclaimer("Can I sue my landlord?",
                "This is general information only.")).doesNotContain(LegalLexicon.DISCLAIMER);
        assertThat(DefaultResponseOrchestrator.withDisclaimer("hello", "Hi!")).isEqualTo("Hi!");
    }

    @Test
    void endedSessionReleasesGuards() {
        DefaultResponseOrchestrator orchestrator = orchestrator();
        orchestrator.handleTextInput("t1", "hello");

        orchestrator.onSessionEnded(new SessionEndedEvent("t1", SessionEndedEvent.DISCONNECT_TIMEOUT, Instant.now()));

        assertThat(orchestrator.handleTextInput("t1", "hello again").response()).isNotBlank();
    }
}
