package com.phillippitts.ellie.service.fallback;

import java.time.Instant;

/**
 * Snapshot of one provider's circuit.
 *
 * @param state                 circuit state
 * @param consecutiveFailures   failures since the last success
 * @param averageResponseTimeMs exponential moving average of call latency
 * @param lastChecked           time of the last recorded call
 * @param openUntil             when an open circuit admits a trial call, or null when not open
 */
public record ProviderStatus(
        ProviderHealthTracker.CircuitState state,
        int consecutiveFailures,
        double averageResponseTimeMs,
        Instant lastChecked,
        Instant openUntil
) {
    public boolean available() {
        return state != ProviderHealthTracker.CircuitState.OPEN;
    }
}
