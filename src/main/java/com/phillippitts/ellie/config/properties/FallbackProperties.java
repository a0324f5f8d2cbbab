package com.phillippitts.ellie.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Circuit-breaker settings used to shed load from failing providers.
 */
@ConfigurationProperties(prefix = "ellie.fallback")
@Validated
public class FallbackProperties {

    /** Consecutive failures that open a provider's circuit. */
    @Positive(message = "Failure threshold must be positive")
    private int failureThreshold = 5;

    /** Seconds an open circuit waits before letting a trial call through. */
    @Positive(message = "Open timeout must be positive")
    private long openTimeoutSeconds = 60;

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public long getOpenTimeoutSeconds() {
        return openTimeoutSeconds;
    }

    public void setOpenTimeoutSeconds(long openTimeoutSeconds) {
        this.openTimeoutSeconds = openTimeoutSeconds;
    }
}
