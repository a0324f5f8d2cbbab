package com.phillippitts.ellie.service.orchestration.event;

import com.phillippitts.ellie.domain.ComplexityClass;

import java.time.Instant;

/**
 * Published once per finished turn. Carries no transcript or reply text.
 *
 * @param channel    "voice" or "text"
 * @param outcome    "response", "fallback" or "error"
 * @param provider   provider of the reply text, or null on error
 * @param complexity classification, or null when the turn never got classified
 */
public record TurnCompletedEvent(
        String sessionId,
        String channel,
        String outcome,
        String provider,
        ComplexityClass complexity,
        boolean cached,
        long durationMs,
        Instant at
) {
}
