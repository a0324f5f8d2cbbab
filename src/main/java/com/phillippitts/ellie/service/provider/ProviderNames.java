package com.phillippitts.ellie.service.provider;

import java.util.List;

/**
 * Canonical provider identifiers used in events, metrics, health tracking and replies.
 */
public final class ProviderNames {

    public static final String WHISPER = "openai-whisper";
    public static final String TTS = "openai-tts";
    public static final String OPENAI_CHAT = "openai-gpt";
    public static final String GROQ = "groq";

    /** Reported as the provider of canned replies. */
    public static final String FALLBACK = "fallback";

    /** Reported as the provider of cache hits. */
    public static final String CACHE = "cache";

    public static final List<String> UPSTREAM = List.of(WHISPER, TTS, OPENAI_CHAT, GROQ);

    private ProviderNames() {
    }
}
