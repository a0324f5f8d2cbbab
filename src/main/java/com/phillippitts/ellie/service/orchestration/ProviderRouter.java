package com.phillippitts.ellie.service.orchestration;

import com.phillippitts.ellie.config.properties.ClassifierProperties;
import com.phillippitts.ellie.domain.ComplexityClass;
import com.phillippitts.ellie.exception.ProviderException;
import com.phillippitts.ellie.exception.ProviderUnavailableException;
import com.phillippitts.ellie.service.classify.LegalLexicon;
import com.phillippitts.ellie.service.provider.ConcurrencyGuard;
import com.phillippitts.ellie.service.provider.GenerationProvider;
import com.phillippitts.ellie.service.provider.GenerationRequest;
import com.phillippitts.ellie.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Chooses the generation provider for a turn and walks the chain until one answers.
 *
 * <p>SIMPLE and MODERATE turns try fast then accurate; COMPLEX turns, and MODERATE turns that are
 * long legal practice-area questions, try accurate then fast. Each provider gets one attempt.
 * When both fail the caller answers with the fallback service.
 */
public class ProviderRouter {

    private static final Logger LOG = LogManager.getLogger(ProviderRouter.class);

    /** A provider together with the caps that guard it. */
    public record Route(GenerationProvider provider, ConcurrencyGuard guard) {
        public Route {
            Objects.requireNonNull(provider, "provider");
            Objects.requireNonNull(guard, "guard");
        }
    }

    private final Route fast;
    private final Route accurate;
    private final StageExecutor stages;
    private final ClassifierProperties classifierProperties;
    private final long timeoutMs;

    public ProviderRouter(Route fast, Route accurate, StageExecutor stages,
                          ClassifierProperties classifierProperties, long timeoutMs) {
        this.fast = Objects.requireNonNull(fast, "fast");
        this.accurate = Objects.requireNonNull(accurate, "accurate");
        this.stages = Objects.requireNonNull(stages, "stages");
        this.classifierProperties = Objects.requireNonNull(classifierProperties, "classifierProperties");
        this.timeoutMs = timeoutMs;
    }

    /**
     * @return true when the accurate provider should be tried first
     */
    public boolean prefersAccurate(ComplexityClass complexity, String transcript) {
        if (complexity == ComplexityClass.COMPLEX) {
            return true;
        }
        return complexity == ComplexityClass.MODERATE
                && transcript.length() > classifierProperties.getLegalRoutingMinLength()
                && LegalLexicon.hasRoutingKeyword(transcript);
    }

    public RoutingResult route(String sessionId, GenerationRequest request) {
        List<Route> chain = prefersAccurate(request.complexity(), request.userText())
                ? List.of(accurate, fast)
                : List.of(fast, accurate);

        boolean allUnavailable = true;
        String lastFailed = null;
        for (Route route : chain) {
            String name = route.provider().getProviderName();
            if (!route.provider().isConfigured()) {
                LOG.debug("Skipping {}: not configured", name);
                lastFailed = name;
                continue;
            }
            try {
                String text = stages.call(route.guard(), sessionId, timeoutMs,
                        () -> route.provider().generate(request));
                LOG.info("Generated via {} (complexity={}, chars={})", name, request.complexity(), text.length());
                return RoutingResult.success(text, name, lastFailed);
            } catch (ProviderUnavailableException e) {
                LOG.warn("Provider {} unavailable: {}", name, e.getMessage());
                lastFailed = name;
            } catch (ProviderException e) {
                LOG.warn("Provider {} failed: {}", name, e.getMessage());
                allUnavailable = false;
                lastFailed = name;
            }
        }
        LOG.warn("No generation provider answered (preview='{}')", LogSanitizer.preview(request.userText()));
        return RoutingResult.exhausted(allUnavailable, lastFailed);
    }

    void forgetSession(String sessionId) {
        fast.guard().forgetSession(sessionId);
        accurate.guard().forgetSession(sessionId);
    }
}
