package com.phillippitts.ellie.service.fallback;

import com.phillippitts.ellie.domain.ComplexityClass;

/**
 * Input to {@link FallbackService#getFallbackResponse}.
 *
 * @param reason     why fallback is used (never null)
 * @param transcript user transcript when known, otherwise null
 * @param complexity classification when known, otherwise null
 * @param sessionId  session the reply is for, used in events only
 * @param category   explicit category; null lets the service choose from reason and transcript
 */
public record FallbackContext(
        FallbackReason reason,
        String transcript,
        ComplexityClass complexity,
        String sessionId,
        FallbackCategory category
) {

    public static FallbackContext transcriptionFailed(String sessionId) {
        return new FallbackContext(FallbackReason.TRANSCRIPTION_FAILED, null, null, sessionId, null);
    }

    public static FallbackContext generationFailed(String sessionId, String transcript, ComplexityClass complexity,
                                                   boolean providersUnavailable) {
        FallbackReason reason = providersUnavailable
                ? FallbackReason.PROVIDERS_UNAVAILABLE
                : FallbackReason.GENERATION_FAILED;
        return new FallbackContext(reason, transcript, complexity, sessionId, null);
    }

    public FallbackContext withCategory(FallbackCategory explicit) {
        return new FallbackContext(reason, transcript, complexity, sessionId, explicit);
    }
}
