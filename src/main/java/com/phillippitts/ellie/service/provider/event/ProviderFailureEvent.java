package com.phillippitts.ellie.service.provider.event;

import java.time.Instant;
import java.util.Map;

/**
 * Published when an upstream provider call fails, times out or is shed for capacity.
 *
 * <p>PII note: never put transcript or reply text in the context. Technical diagnostics only.
 */
public record ProviderFailureEvent(
        String provider,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public ProviderFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
