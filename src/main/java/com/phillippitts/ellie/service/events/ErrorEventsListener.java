package com.phillippitts.ellie.service.events;

import com.phillippitts.ellie.client.capture.CaptureErrorEvent;
import com.phillippitts.ellie.service.fallback.event.FallbackUsedEvent;
import com.phillippitts.ellie.service.provider.event.ProviderFailureEvent;
import com.phillippitts.ellie.service.session.SessionEndedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central operator-facing log of degraded behavior. Privacy-safe and throttled per key so an
 * upstream outage produces one line a minute, not one per turn.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener() {
        this(Clock.systemUTC());
    }

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onProviderFailure(ProviderFailureEvent e) {
        String reason = e.context().getOrDefault("reason", "error");
        if (shouldLog("provider-" + e.provider() + '-' + reason)) {
            LOG.warn("Provider {} failing: reason={}, message={}. Check API key, quota and upstream status.",
                    e.provider(), reason, e.message());
        }
    }

    @EventListener
    void onFallbackUsed(FallbackUsedEvent e) {
        if (shouldLog("fallback-" + e.reason())) {
            LOG.warn("Serving fallback replies: reason={}, failedProvider={}", e.reason(), e.failedProvider());
        }
    }

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        if (shouldLog("capture-" + e.reason())) {
            LOG.warn("Capture error: reason={}. Check microphone device & permissions.", e.reason());
        }
    }

    @EventListener
    void onSessionEnded(SessionEndedEvent e) {
        LOG.debug("Session {} ended ({})", e.sessionId(), e.reason());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
