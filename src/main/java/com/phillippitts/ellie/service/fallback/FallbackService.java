package com.phillippitts.ellie.service.fallback;

import com.phillippitts.ellie.domain.AudioResponse;

/**
 * Produces a reply without calling any upstream provider.
 *
 * <p>Implementations must never throw and must be deterministic for a given context, so a retried
 * turn gets the same words.
 */
public interface FallbackService {

    /**
     * @param context failure context; a null context yields the generic technical-difficulty reply
     * @return a reply flagged {@code fallback=true}, carrying a local audio cue
     */
    AudioResponse getFallbackResponse(FallbackContext context);

    /**
     * @return the audio cue played when speech synthesis is unavailable
     */
    byte[] audioCue();
}
