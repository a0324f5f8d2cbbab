package com.phillippitts.ellie.service.fallback;

import java.util.Map;

/**
 * Body of {@code GET /api/monitoring/fallbacks}.
 */
public record FallbackStats(
        long totalFallbacks,
        Map<FallbackReason, Long> fallbacksByReason,
        Map<String, ProviderStatus> providers
) {
}
