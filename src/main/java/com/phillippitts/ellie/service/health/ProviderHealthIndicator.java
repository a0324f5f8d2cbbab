package com.phillippitts.ellie.service.health;

import com.phillippitts.ellie.service.fallback.ProviderHealthTracker;
import com.phillippitts.ellie.service.fallback.ProviderStatus;
import com.phillippitts.ellie.service.provider.GenerationProvider;
import com.phillippitts.ellie.service.provider.SynthesisProvider;
import com.phillippitts.ellie.service.provider.TranscriptionProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health of the upstream AI providers.
 *
 * <ul>
 *   <li>UP: transcription, synthesis and at least one generation provider ready</li>
 *   <li>DEGRADED: anything less; turns are still answered, from fallbacks where needed</li>
 * </ul>
 *
 * <p>The service never reports DOWN because of a provider: the canned fallback always answers.
 * Exposed via /actuator/health.
 */
@Component
public class ProviderHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final TranscriptionProvider transcription;
    private final SynthesisProvider synthesis;
    private final List<GenerationProvider> generation;
    private final ProviderHealthTracker tracker;

    public ProviderHealthIndicator(TranscriptionProvider transcription,
                                   SynthesisProvider synthesis,
                                   List<GenerationProvider> generation,
                                   ProviderHealthTracker tracker) {
        this.transcription = transcription;
        this.synthesis = synthesis;
        this.generation = List.copyOf(generation);
        this.tracker = tracker;
    }

    @Override
    public Health health() {
        Map<String, ProviderStatus> circuits = tracker.providerStatuses();
        Map<String, String> details = new LinkedHashMap<>();
        boolean sttReady = record(details, circuits, transcription.getProviderName(), transcription.isConfigured());
        boolean ttsReady = record(details, circuits, synthesis.getProviderName(), synthesis.isConfigured());
        boolean anyGeneration = false;
        for (GenerationProvider provider : generation) {
            anyGeneration |= record(details, circuits, provider.getProviderName(), provider.isConfigured());
        }

        Health.Builder builder = sttReady && ttsReady && anyGeneration
                ? Health.up().withDetail("status", "All providers operational")
                : Health.status(DEGRADED).withDetail("status", "Serving with fallbacks");
        return builder.withDetails(details).build();
    }

    private static boolean record(Map<String, String> details, Map<String, ProviderStatus> circuits,
                                  String provider, boolean configured) {
        ProviderStatus circuit = circuits.get(provider);
        String status;
        if (!configured) {
            status = "unconfigured";
        } else if (circuit != null && !circuit.available()) {
            status = "circuit-open";
        } else {
            status = "ready";
        }
        details.put(provider, status);
        return "ready".equals(status);
    }
}
