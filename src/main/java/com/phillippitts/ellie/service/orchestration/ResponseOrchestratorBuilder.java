package com.phillippitts.ellie.service.orchestration;

import com.phillippitts.ellie.config.properties.CacheProperties;
import com.phillippitts.ellie.config.properties.OrchestrationProperties;
import com.phillippitts.ellie.service.cache.ResponseCache;
import com.phillippitts.ellie.service.classify.ComplexityClassifier;
import com.phillippitts.ellie.service.fallback.FallbackService;
import com.phillippitts.ellie.service.metrics.OrchestrationMetrics;
import com.phillippitts.ellie.service.provider.ConcurrencyGuard;
import com.phillippitts.ellie.service.provider.SynthesisProvider;
import com.phillippitts.ellie.service.provider.TranscriptionProvider;
import com.phillippitts.ellie.service.session.SessionRegistry;
import com.phillippitts.ellie.service.validation.AudioValidator;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link DefaultResponseOrchestrator}.
 *
 * <pre>{@code
 * ResponseOrchestrator orchestrator = ResponseOrchestratorBuilder.builder()
 *     .validator(validator)
 *     .transcription(whisper, sttGuard)
 *     .classifier(classifier)
 *     .router(router)
 *     .synthesis(tts, ttsGuard)
 *     .caches(textCache, audioCache, cacheProps)
 *     .fallbackService(fallbacks)
 *     .sessions(registry)
 *     .stages(stageExecutor)
 *     .turnExecutor(turnExecutor)
 *     .properties(orchestrationProps)
 *     .metrics(metrics)
 *     .publisher(publisher)
 *     .build();
 * }</pre>
 *
 * <p>Every dependency is required.
 */
public final class ResponseOrchestratorBuilder {

    AudioValidator validator;
    TranscriptionProvider transcription;
    ConcurrencyGuard transcriptionGuard;
    ComplexityClassifier classifier;
    ProviderRouter router;
    SynthesisProvider synthesis;
    ConcurrencyGuard synthesisGuard;
    ResponseCache<String> textCache;
    ResponseCache<byte[]> audioCache;
    CacheProperties cacheProperties;
    FallbackService fallbackService;
    SessionRegistry sessions;
    StageExecutor stages;
    Executor turnExecutor;
    OrchestrationProperties properties;
    OrchestrationMetrics metrics;
    ApplicationEventPublisher publisher;

    private ResponseOrchestratorBuilder() {
    }

    public static ResponseOrchestratorBuilder builder() {
        return new ResponseOrchestratorBuilder();
    }

    public ResponseOrchestratorBuilder validator(AudioValidator validator) {
        this.validator = validator;
        return this;
    }

    /**
     * @param provider speech-to-text provider
     * @param guard    concurrency limits for that provider
     */
    public ResponseOrchestratorBuilder transcription(TranscriptionProvider provider, ConcurrencyGuard guard) {
        this.transcription = provider;
        this.transcriptionGuard = guard;
        return this;
    }

    public ResponseOrchestratorBuilder classifier(ComplexityClassifier classifier) {
        this.classifier = classifier;
        return this;
    }

    public ResponseOrchestratorBuilder router(ProviderRouter router) {
        this.router = router;
        return this;
    }

    /**
     * @param provider text-to-speech provider
     * @param guard    concurrency limits for that provider
     */
    public ResponseOrchestratorBuilder synthesis(SynthesisProvider provider, ConcurrencyGuard guard) {
        this.synthesis = provider;
        this.synthesisGuard = guard;
        return this;
    }

    public ResponseOrchestratorBuilder caches(ResponseCache<String> textCache,
                                              ResponseCache<byte[]> audioCache,
                                              CacheProperties cacheProperties) {
        this.textCache = textCache;
        this.audioCache = audioCache;
        this.cacheProperties = cacheProperties;
        return this;
    }

    public ResponseOrchestratorBuilder fallbackService(FallbackService fallbackService) {
        this.fallbackService = fallbackService;
        return this;
    }

    public ResponseOrchestratorBuilder sessions(SessionRegistry sessions) {
        this.sessions = sessions;
        return this;
    }

    public ResponseOrchestratorBuilder stages(StageExecutor stages) {
        this.stages = stages;
        return this;
    }

    /** Executor that runs whole voice turns off the caller's thread. */
    public ResponseOrchestratorBuilder turnExecutor(Executor turnExecutor) {
        this.turnExecutor = turnExecutor;
        return this;
    }

    public ResponseOrchestratorBuilder properties(OrchestrationProperties properties) {
        this.properties = properties;
        return this;
    }

    public ResponseOrchestratorBuilder metrics(OrchestrationMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    public ResponseOrchestratorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    /**
     * @return configured orchestrator
     * @throws NullPointerException if a dependency is missing
     */
    public DefaultResponseOrchestrator build() {
        Objects.requireNonNull(validator, "validator is required");
        Objects.requireNonNull(transcription, "transcription provider is required");
        Objects.requireNonNull(transcriptionGuard, "transcription guard is required");
        Objects.requireNonNull(classifier, "classifier is required");
        Objects.requireNonNull(router, "router is required");
        Objects.requireNonNull(synthesis, "synthesis provider is required");
        Objects.requireNonNull(synthesisGuard, "synthesis guard is required");
        Objects.requireNonNull(textCache, "text cache is required");
        Objects.requireNonNull(audioCache, "audio cache is required");
        Objects.requireNonNull(cacheProperties, "cache properties are required");
        Objects.requireNonNull(fallbackService, "fallback service is required");
        Objects.requireNonNull(sessions, "session registry is required");
        Objects.requireNonNull(stages, "stage executor is required");
        Objects.requireNonNull(turnExecutor, "turn executor is required");
        Objects.requireNonNull(properties, "orchestration properties are required");
        Objects.requireNonNull(metrics, "metrics are required");
        Objects.requireNonNull(publisher, "publisher is required");
        return new DefaultResponseOrchestrator(this);
    }
}
