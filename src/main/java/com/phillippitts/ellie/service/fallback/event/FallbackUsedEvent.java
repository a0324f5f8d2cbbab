package com.phillippitts.ellie.service.fallback.event;

import com.phillippitts.ellie.service.fallback.FallbackReason;

import java.time.Instant;

/**
 * Published when a turn is answered by the fallback service or delivered with the audio cue
 * instead of synthesized speech.
 *
 * @param sessionId      session of the turn
 * @param reason         why fallback was used
 * @param failedProvider last provider that failed, or null when none was called
 * @param at             event time
 */
public record FallbackUsedEvent(String sessionId, FallbackReason reason, String failedProvider, Instant at) {

    public FallbackUsedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
