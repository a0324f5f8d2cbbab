package com.phillippitts.ellie.config.orchestration;

import com.phillippitts.ellie.config.properties.CacheProperties;
import com.phillippitts.ellie.config.properties.ClassifierProperties;
import com.phillippitts.ellie.config.properties.OrchestrationProperties;
import com.phillippitts.ellie.service.cache.ResponseCache;
import com.phillippitts.ellie.service.classify.ComplexityClassifier;
import com.phillippitts.ellie.service.fallback.FallbackService;
import com.phillippitts.ellie.service.fallback.ProviderHealthTracker;
import com.phillippitts.ellie.service.metrics.OrchestrationMetrics;
import com.phillippitts.ellie.service.orchestration.DefaultResponseOrchestrator;
import com.phillippitts.ellie.service.orchestration.ProviderRouter;
import com.phillippitts.ellie.service.orchestration.ResponseOrchestratorBuilder;
import com.phillippitts.ellie.service.orchestration.StageExecutor;
import com.phillippitts.ellie.service.provider.ConcurrencyGuard;
import com.phillippitts.ellie.service.provider.GenerationProvider;
import com.phillippitts.ellie.service.provider.SynthesisProvider;
import com.phillippitts.ellie.service.provider.TranscriptionProvider;
import com.phillippitts.ellie.service.session.SessionRegistry;
import com.phillippitts.ellie.service.validation.AudioValidator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the response pipeline explicitly: one concurrency guard per upstream provider, the stage
 * executor, the generation router and the orchestrator.
 */
@Configuration
public class OrchestrationConfig {

    private final OrchestrationProperties props;
    private final ApplicationEventPublisher publisher;

    public OrchestrationConfig(OrchestrationProperties props, ApplicationEventPublisher publisher) {
        this.props = props;
        this.publisher = publisher;
    }

    @Bean
    public StageExecutor stageExecutor(@Qualifier("providerExecutor") Executor providerExecutor,
                                       ProviderHealthTracker health,
                                       OrchestrationMetrics metrics) {
        return new StageExecutor(providerExecutor, health, metrics, publisher);
    }

    @Bean
    public ProviderRouter providerRouter(@Qualifier("fastGenerationProvider") GenerationProvider fast,
                                         @Qualifier("accurateGenerationProvider") GenerationProvider accurate,
                                         StageExecutor stageExecutor,
                                         ClassifierProperties classifierProperties) {
        return new ProviderRouter(
                new ProviderRouter.Route(fast, guard(fast.getProviderName())),
                new ProviderRouter.Route(accurate, guard(accurate.getProviderName())),
                stageExecutor, classifierProperties, props.getGenerationTimeoutMs());
    }

    @Bean
    public DefaultResponseOrchestrator responseOrchestrator(AudioValidator validator,
                                                            TranscriptionProvider transcriptionProvider,
                                                            ComplexityClassifier classifier,
                                                            ProviderRouter providerRouter,
                                                            SynthesisProvider synthesisProvider,
                                                            ResponseCache<String> textResponseCache,
                                                            ResponseCache<byte[]> audioResponseCache,
                                                            CacheProperties cacheProperties,
                                                            FallbackService fallbackService,
                                                            SessionRegistry sessionRegistry,
                                                            StageExecutor stageExecutor,
                                                            @Qualifier("turnExecutor") Executor turnExecutor,
                                                            OrchestrationMetrics metrics) {
        return ResponseOrchestratorBuilder.builder()
                .validator(validator)
                .transcription(transcriptionProvider, guard(transcriptionProvider.getProviderName()))
                .classifier(classifier)
                .router(providerRouter)
                .synthesis(synthesisProvider, guard(synthesisProvider.getProviderName()))
                .caches(textResponseCache, audioResponseCache, cacheProperties)
                .fallbackService(fallbackService)
                .sessions(sessionRegistry)
                .stages(stageExecutor)
                .turnExecutor(turnExecutor)
                .properties(props)
                .metrics(metrics)
                .publisher(publisher)
                .build();
    }

    private ConcurrencyGuard guard(String providerName) {
        return new ConcurrencyGuard(providerName, props.getGlobalConcurrency(), props.getPerSessionConcurrency(),
                props.getAcquireTimeoutMs(), publisher);
    }
}
