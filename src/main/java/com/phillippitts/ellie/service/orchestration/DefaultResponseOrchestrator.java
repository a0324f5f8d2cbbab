package com.phillippitts.ellie.service.orchestration;

import com.phillippitts.ellie.config.properties.CacheProperties;
import com.phillippitts.ellie.config.properties.OrchestrationProperties;
import com.phillippitts.ellie.domain.AudioInput;
import com.phillippitts.ellie.domain.AudioResponse;
import com.phillippitts.ellie.domain.ComplexityClass;
import com.phillippitts.ellie.domain.ConversationContext;
import com.phillippitts.ellie.domain.Message;
import com.phillippitts.ellie.domain.MessageMetadata;
import com.phillippitts.ellie.domain.TextReply;
import com.phillippitts.ellie.domain.TranscriptionResult;
import com.phillippitts.ellie.exception.CacheException;
import com.phillippitts.ellie.exception.EllieException;
import com.phillippitts.ellie.exception.ErrorCode;
import com.phillippitts.ellie.exception.InvalidAudioException;
import com.phillippitts.ellie.exception.ProviderException;
import com.phillippitts.ellie.service.cache.CacheFingerprints;
import com.phillippitts.ellie.service.cache.ResponseCache;
import com.phillippitts.ellie.service.classify.ComplexityClassifier;
import com.phillippitts.ellie.service.classify.LegalLexicon;
import com.phillippitts.ellie.service.fallback.FallbackContext;
import com.phillippitts.ellie.service.fallback.FallbackReason;
import com.phillippitts.ellie.service.fallback.FallbackService;
import com.phillippitts.ellie.service.fallback.event.FallbackUsedEvent;
import com.phillippitts.ellie.service.metrics.OrchestrationMetrics;
import com.phillippitts.ellie.service.orchestration.event.TurnCompletedEvent;
import com.phillippitts.ellie.service.provider.ConcurrencyGuard;
import com.phillippitts.ellie.service.provider.GenerationRequest;
import com.phillippitts.ellie.service.provider.ProviderNames;
import com.phillippitts.ellie.service.provider.SynthesisProvider;
import com.phillippitts.ellie.service.provider.TranscriptionProvider;
import com.phillippitts.ellie.service.session.ConversationSession;
import com.phillippitts.ellie.service.session.SessionEndedEvent;
import com.phillippitts.ellie.service.session.SessionRegistry;
import com.phillippitts.ellie.service.validation.AudioValidator;
import com.phillippitts.ellie.util.LogSanitizer;
import com.phillippitts.ellie.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Default {@link ResponseOrchestrator}.
 *
 * <p>Voice pipeline, each stage caught at its boundary:
 * <ol>
 *   <li>validate audio (invalid input ends the turn with an error)</li>
 *   <li>transcribe; on failure answer from the fallback service</li>
 *   <li>classify; on failure assume MODERATE</li>
 *   <li>look up the reply cache; on hit skip generation</li>
 *   <li>route to a generation provider; on exhaustion answer from the fallback service</li>
 *   <li>synthesize (audio cache first); on failure deliver the text with the audio cue</li>
 * </ol>
 *
 * <p>Turns of one session hold the session's turn lock for their whole run. The caller's sink is
 * wrapped so exactly one terminal event is delivered. A sink detached by a disconnect simply drops
 * the delivery; the turn itself still completes and fills the caches.
 *
 * <p>Build instances with {@link ResponseOrchestratorBuilder}.
 */
public class DefaultResponseOrchestrator implements ResponseOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultResponseOrchestrator.class);

    static final String CHANNEL_VOICE = "voice";
    static final String CHANNEL_TEXT = "text";
    private static final double TEXT_INPUT_CONFIDENCE = 1.0;

    private final AudioValidator validator;
    private final TranscriptionProvider transcription;
    private final ConcurrencyGuard transcriptionGuard;
    private final ComplexityClassifier classifier;
    private final ProviderRouter router;
    private final SynthesisProvider synthesis;
    private final ConcurrencyGuard synthesisGuard;
    private final ResponseCache<String> textCache;
    private final ResponseCache<byte[]> audioCache;
    private final CacheProperties cacheProperties;
    private final FallbackService fallbackService;
    private final SessionRegistry sessions;
    private final StageExecutor stages;
    private final Executor turnExecutor;
    private final OrchestrationProperties props;
    private final OrchestrationMetrics metrics;
    private final ApplicationEventPublisher publisher;

    /** Reply text plus where it came from, before synthesis. */
    private record Reply(String text, String provider, double confidence, ComplexityClass complexity,
                         boolean cached, boolean fallback, String transcript) {
    }

    DefaultResponseOrchestrator(ResponseOrchestratorBuilder b) {
        this.validator = b.validator;
        this.transcription = b.transcription;
        this.transcriptionGuard = b.transcriptionGuard;
        this.classifier = b.classifier;
        this.router = b.router;
        this.synthesis = b.synthesis;
        this.synthesisGuard = b.synthesisGuard;
        this.textCache = b.textCache;
        this.audioCache = b.audioCache;
        this.cacheProperties = b.cacheProperties;
        this.fallbackService = b.fallbackService;
        this.sessions = b.sessions;
        this.stages = b.stages;
        this.turnExecutor = b.turnExecutor;
        this.props = b.properties;
        this.metrics = b.metrics;
        this.publisher = b.publisher;
    }

    @Override
    public CompletableFuture<Void> handleVoiceInput(String sessionId, AudioInput audio, TurnEventSink sink) {
        if (sessionId == null || sink == null) {
            throw new IllegalArgumentException("sessionId and sink are required");
        }
        String requestId = Optional.ofNullable(ThreadContext.get("requestId"))
                .orElseGet(() -> UUID.randomUUID().toString());
        TerminalOnceSink turnSink = new TerminalOnceSink(sessionId, requestId, sink);
        try {
            return CompletableFuture
                    .runAsync(() -> runVoiceTurn(sessionId, requestId, audio, turnSink), turnExecutor)
                    .handle((ignored, error) -> {
                        if (error != null) {
                            LOG.error("Voice turn for session {} failed unexpectedly", sessionId, error);
                        }
                        if (!turnSink.isTerminated()) {
                            turnSink.error(ErrorCode.INTERNAL_SERVER_ERROR, null);
                        }
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            LOG.warn("Turn executor rejected voice turn for session {}", sessionId);
            turnSink.error(ErrorCode.SERVICE_UNAVAILABLE, null);
            return CompletableFuture.completedFuture(null);
        }
    }

    @Override
    public TextReply handleTextInput(String sessionId, String text) {
        if (sessionId == null || sessionId.isBlank() || text == null || text.isBlank()) {
            throw new EllieException(ErrorCode.INVALID_INPUT, "sessionId and message must not be blank");
        }
        long t0 = System.nanoTime();
        String trimmed = text.trim();
        ConversationSession session = sessions.getOrCreate(sessionId);
        session.turnLock().lock();
        try {
            Reply reply = answer(session, trimmed, TEXT_INPUT_CONFIDENCE, TurnEventSink.discarding());
            long ms = TimeUtils.elapsedMillis(t0);
            session.recordExchange(Message.user(trimmed),
                    Message.assistant(reply.text(), null,
                            new MessageMetadata(reply.confidence(), ms, reply.provider())),
                    reply.complexity());
            finish(sessionId, CHANNEL_TEXT, reply, ms);
            return new TextReply(reply.text(), ms, reply.provider(), reply.fallback());
        } finally {
            session.turnLock().unlock();
        }
    }

    @EventListener
    public void onSessionEnded(SessionEndedEvent event) {
        transcriptionGuard.forgetSession(event.sessionId());
        synthesisGuard.forgetSession(event.sessionId());
        router.forgetSession(event.sessionId());
    }

    private void runVoiceTurn(String sessionId, String requestId, AudioInput audio, TerminalOnceSink sink) {
        ThreadContext.put("sessionId", sessionId);
        ThreadContext.put("requestId", requestId);
        long t0 = System.nanoTime();
        try {
            validator.validate(audio);
        } catch (InvalidAudioException e) {
            LOG.warn("Rejected audio for session {}: {}", sessionId, e.getMessage());
            sink.error(ErrorResponse.of(e.getErrorCode(), e.getReason(), requestId, sessionId));
            recordError(sessionId, CHANNEL_VOICE, null, TimeUtils.elapsedMillis(t0));
            return;
        }

        ConversationSession session = sessions.getOrCreate(sessionId);
        session.turnLock().lock();
        try {
            sink.status(TurnStatus.PROCESSING, "transcribing");
            Reply reply = transcribeAndAnswer(session, audio, sink);
            if (reply == null) {
                reply = fromFallback(sessionId, FallbackContext.transcriptionFailed(sessionId), null);
            }

            sink.status(TurnStatus.PROCESSING, "synthesizing");
            String audioFingerprint = CacheFingerprints.audio(reply.text(), synthesis.voice(), synthesis.speed());
            byte[] speech = synthesize(sessionId, reply.text(), audioFingerprint);

            long ms = TimeUtils.elapsedMillis(t0);
            AudioResponse response = new AudioResponse(reply.text(), speech, reply.confidence(), ms,
                    reply.provider(), reply.complexity(), reply.cached(), reply.fallback(), reply.transcript());
            sink.status(TurnStatus.SPEAKING, "response ready");
            sink.response(response);
            finish(sessionId, CHANNEL_VOICE, reply, ms);
        } catch (RuntimeException e) {
            // Only reachable when the fallback service itself fails
            LOG.error("Voice turn for session {} could not be answered", sessionId, e);
            sink.error(ErrorResponse.of(ErrorCode.AUDIO_PROCESSING_FAILED, null, requestId, sessionId));
            recordError(sessionId, CHANNEL_VOICE, null, TimeUtils.elapsedMillis(t0));
        } finally {
            session.turnLock().unlock();
        }
    }

    /**
     * @return the reply, or null when transcription failed or heard nothing
     */
    private Reply transcribeAndAnswer(ConversationSession session, AudioInput audio, TurnEventSink sink) {
        String sessionId = session.getId();
        TranscriptionResult transcript;
        try {
            transcript = stages.call(transcriptionGuard, sessionId, props.getTranscriptionTimeoutMs(),
                    () -> transcription.transcribe(audio));
        } catch (ProviderException e) {
            LOG.warn("Transcription failed for session {}: {}", sessionId, e.getMessage());
            return fromFallback(sessionId, FallbackContext.transcriptionFailed(sessionId),
                    transcription.getProviderName());
        }
        if (transcript.isBlank()) {
            LOG.info("Empty transcript for session {}", sessionId);
            return null;
        }
        LOG.debug("Transcript for session {}: '{}'", sessionId, LogSanitizer.preview(transcript.text()));
        Reply reply = answer(session, transcript.text(), transcript.confidence(), sink);
        session.recordExchange(Message.user(transcript.text()),
                Message.assistant(reply.text(), null, new MessageMetadata(reply.confidence(), null, reply.provider())),
                reply.complexity());
        return reply;
    }

    /**
     * Classification, cache lookup, routing and fallback. Shared by voice and text turns.
     */
    private Reply answer(ConversationSession session, String transcript, double confidence, TurnEventSink sink) {
        String sessionId = session.getId();
        ConversationContext context = session.context(props.getHistoryWindow());
        ComplexityClass complexity = classify(transcript, context);

        String fingerprint = CacheFingerprints.text(transcript);
        Optional<String> cached = cacheGet(textCache, "text", fingerprint);
        if (cached.isPresent()) {
            LOG.debug("Reply cache hit for session {}", sessionId);
            return new Reply(cached.get(), ProviderNames.CACHE, confidence, complexity, true, false, transcript);
        }

        sink.status(TurnStatus.PROCESSING, "generating");
        GenerationRequest request = new GenerationRequest(transcript, context.recentMessages(),
                props.getSystemPrompt(), complexity);
        RoutingResult routed = router.route(sessionId, request);
        if (!routed.succeeded()) {
            FallbackContext fallbackContext = FallbackContext.generationFailed(sessionId, transcript, complexity,
                    routed.allUnavailable());
            return fromFallback(sessionId, fallbackContext, routed.lastFailedProvider());
        }

        String text = withDisclaimer(transcript, routed.text());
        Duration ttl = complexity == ComplexityClass.SIMPLE ? cacheProperties.simpleTextTtl() : cacheProperties.textTtl();
        String retained = cachePut(textCache, fingerprint, text, ttl);
        return new Reply(retained, routed.provider(), confidence, complexity, false, false, transcript);
    }

    private ComplexityClass classify(String transcript, ConversationContext context) {
        try {
            return classifier.classify(transcript, context);
        } catch (RuntimeException e) {
            LOG.warn("Classification failed, assuming MODERATE: {}", e.toString());
            return ComplexityClass.MODERATE;
        }
    }

    static String withDisclaimer(String question, String reply) {
        if (LegalLexicon.isLegalQuery(question) && !LegalLexicon.hasDisclaimer(reply)) {
            return reply + " " + LegalLexicon.DISCLAIMER;
        }
        return reply;
    }

    private byte[] synthesize(String sessionId, String text, String fingerprint) {
        Optional<byte[]> cached = cacheGet(audioCache, "audio", fingerprint);
        if (cached.isPresent()) {
            return cached.get();
        }
        if (synthesis.isConfigured()) {
            try {
                byte[] speech = stages.call(synthesisGuard, sessionId, props.getSynthesisTimeoutMs(),
                        () -> synthesis.synthesize(text));
                return cachePut(audioCache, fingerprint, speech, cacheProperties.audioTtl());
            } catch (ProviderException e) {
                LOG.warn("Synthesis failed for session {}: {}", sessionId, e.getMessage());
            }
        }
        recordFallback(sessionId, FallbackReason.SYNTHESIS_FAILED, synthesis.getProviderName());
        return fallbackService.audioCue();
    }

    private Reply fromFallback(String sessionId, FallbackContext context, String failedProvider) {
        recordFallback(sessionId, context.reason(), failedProvider);
        AudioResponse canned = fallbackService.getFallbackResponse(context);
        if (canned == null) {
            throw new IllegalStateException("Fallback service returned no reply");
        }
        return new Reply(canned.text(), canned.provider(), canned.confidence(), canned.complexity(), false, true,
                canned.transcript());
    }

    private void recordFallback(String sessionId, FallbackReason reason, String failedProvider) {
        metrics.incrementFallback(reason.name());
        publisher.publishEvent(new FallbackUsedEvent(sessionId, reason, failedProvider, Instant.now()));
    }

    private <T> Optional<T> cacheGet(ResponseCache<T> cache, String name, String fingerprint) {
        if (!cacheProperties.isEnabled()) {
            return Optional.empty();
        }
        try {
            Optional<T> value = cache.get(fingerprint);
            if (value.isPresent()) {
                metrics.incrementCacheHit(name);
            } else {
                metrics.incrementCacheMiss(name);
            }
            return value;
        } catch (CacheException e) {
            LOG.warn("Cache {} read failed, treating as miss: {}", name, e.getMessage());
            metrics.incrementCacheMiss(name);
            return Optional.empty();
        }
    }

    private <T> T cachePut(ResponseCache<T> cache, String fingerprint, T value, Duration ttl) {
        if (!cacheProperties.isEnabled()) {
            return value;
        }
        try {
            return cache.put(fingerprint, value, ttl);
        } catch (CacheException e) {
            LOG.warn("Cache write failed, continuing uncached: {}", e.getMessage());
            return value;
        }
    }

    private void finish(String sessionId, String channel, Reply reply, long ms) {
        String outcome = reply.fallback() ? "fallback" : "response";
        metrics.recordTurn(channel, outcome, ms);
        publisher.publishEvent(new TurnCompletedEvent(sessionId, channel, outcome, reply.provider(),
                reply.complexity(), reply.cached(), ms, Instant.now()));
    }

    private void recordError(String sessionId, String channel, ComplexityClass complexity, long ms) {
        metrics.recordTurn(channel, "error", ms);
        publisher.publishEvent(new TurnCompletedEvent(sessionId, channel, "error", null, complexity, false, ms,
                Instant.now()));
    }
}
