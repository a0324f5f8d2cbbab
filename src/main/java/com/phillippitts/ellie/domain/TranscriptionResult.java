package com.phillippitts.ellie.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of a speech-to-text call.
 *
 * @param text         transcribed text (must not be null, may be empty for silence)
 * @param confidence   confidence score between 0.0 and 1.0
 * @param timestamp    when the transcription completed
 * @param providerName provider that produced this result
 */
public record TranscriptionResult(
        String text,
        double confidence,
        Instant timestamp,
        String providerName
) {

    /**
     * @throws IllegalArgumentException if confidence is out of range
     * @throws NullPointerException if text, timestamp, or providerName is null
     */
    public TranscriptionResult {
        Objects.requireNonNull(text, "Transcription text must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence
            );
        }
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(providerName, "Provider name must not be null");
    }

    public static TranscriptionResult of(String text, double confidence, String providerName) {
        return new TranscriptionResult(text, confidence, Instant.now(), providerName);
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
