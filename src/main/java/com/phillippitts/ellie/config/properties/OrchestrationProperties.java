package com.phillippitts.ellie.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the response orchestrator: per-stage timeouts, provider concurrency caps
 * and the prompt sent to generation providers.
 */
@Validated
@ConfigurationProperties(prefix = "ellie.orchestration")
public class OrchestrationProperties {

    static final String DEFAULT_SYSTEM_PROMPT = "You are Ellie, a friendly voice assistant for a law firm. "
            + "Answer in a few short, spoken-style sentences. Do not give legal advice; suggest a consultation "
            + "with an attorney when a question needs one.";

    @Positive
    private final long transcriptionTimeoutMs;

    @Positive
    private final long generationTimeoutMs;

    @Positive
    private final long synthesisTimeoutMs;

    /** In-flight calls one session may have against a single provider. */
    @Positive
    private final int perSessionConcurrency;

    /** In-flight calls all sessions together may have against a single provider. */
    @Positive
    private final int globalConcurrency;

    /** How long a caller waits for a concurrency permit before being routed to fallback. */
    @Min(0)
    private final long acquireTimeoutMs;

    /** Number of prior messages passed to generation providers as context. */
    @Min(0)
    private final int historyWindow;

    @NotBlank
    private final String systemPrompt;

    @ConstructorBinding
    public OrchestrationProperties(Long transcriptionTimeoutMs,
                                   Long generationTimeoutMs,
                                   Long synthesisTimeoutMs,
                                   Integer perSessionConcurrency,
                                   Integer globalConcurrency,
                                   Long acquireTimeoutMs,
                                   Integer historyWindow,
                                   String systemPrompt) {
        this.transcriptionTimeoutMs = transcriptionTimeoutMs == null ? 15_000L : transcriptionTimeoutMs;
        this.generationTimeoutMs = generationTimeoutMs == null ? 20_000L : generationTimeoutMs;
        this.synthesisTimeoutMs = synthesisTimeoutMs == null ? 15_000L : synthesisTimeoutMs;
        this.perSessionConcurrency = perSessionConcurrency == null ? 2 : perSessionConcurrency;
        this.globalConcurrency = globalConcurrency == null ? 8 : globalConcurrency;
        this.acquireTimeoutMs = acquireTimeoutMs == null ? 250L : acquireTimeoutMs;
        this.historyWindow = historyWindow == null ? 10 : historyWindow;
        this.systemPrompt = systemPrompt == null ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
    }

    /**
     * All defaults. Used by tests and by code paths that run outside a Spring context.
     */
    public static OrchestrationProperties defaults() {
        return new OrchestrationProperties(null, null, null, null, null, null, null, null);
    }

    public long getTranscriptionTimeoutMs() {
        return transcriptionTimeoutMs;
    }

    public long getGenerationTimeoutMs() {
        return generationTimeoutMs;
    }

    public long getSynthesisTimeoutMs() {
        return synthesisTimeoutMs;
    }

    public int getPerSessionConcurrency() {
        return perSessionConcurrency;
    }

    public int getGlobalConcurrency() {
        return globalConcurrency;
    }

    public long getAcquireTimeoutMs() {
        return acquireTimeoutMs;
    }

    public int getHistoryWindow() {
        return historyWindow;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }
}
