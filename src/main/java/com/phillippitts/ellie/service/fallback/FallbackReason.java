package com.phillippitts.ellie.service.fallback;

/**
 * Why a turn is being answered by the fallback service.
 */
public enum FallbackReason {
    /** Speech-to-text failed, timed out or was shed. */
    TRANSCRIPTION_FAILED,
    /** Every generation provider in the chain failed. */
    GENERATION_FAILED,
    /** Every generation provider was skipped because its circuit is open or it is at capacity. */
    PROVIDERS_UNAVAILABLE,
    /** Speech synthesis failed; the text is kept and an audio cue replaces speech. */
    SYNTHESIS_FAILED
}
