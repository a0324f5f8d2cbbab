package com.phillippitts.ellie.domain;

import java.util.Objects;

/**
 * Bundled reply for one user turn, delivered once as an {@code ai-response} event.
 *
 * <p>Fallback replies use the same shape; only {@code fallback} and {@code provider} tell them apart.
 *
 * @param text             reply text
 * @param audio            synthesized audio bytes (may be empty when synthesis was skipped)
 * @param confidence       confidence score between 0.0 and 1.0
 * @param processingTimeMs total processing time for the turn
 * @param provider         provider that generated the text
 * @param complexity       complexity class of the turn, or null when the turn never got classified
 * @param cached           true if the text came from the response cache
 * @param fallback         true if the text is a canned fallback reply
 * @param transcript       what the user said, or null when nothing usable was heard
 */
public record AudioResponse(
        String text,
        byte[] audio,
        double confidence,
        long processingTimeMs,
        String provider,
        ComplexityClass complexity,
        boolean cached,
        boolean fallback,
        String transcript
) {

    public AudioResponse {
        Objects.requireNonNull(text, "text must not be null");
        audio = audio == null ? new byte[0] : audio;
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public boolean hasAudio() {
        return audio.length > 0;
    }

    /** Returns a copy with the total processing time of the turn filled in. */
    public AudioResponse withProcessingTime(long millis) {
        return new AudioResponse(text, audio, confidence, millis, provider, complexity, cached, fallback,
                transcript);
    }

    public AudioResponse withAudio(byte[] synthesized) {
        return new AudioResponse(text, synthesized, confidence, processingTimeMs, provider, complexity, cached,
                fallback, transcript);
    }
}
