package com.phillippitts.ellie.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Response cache TTLs and size bound.
 */
@ConfigurationProperties(prefix = "ellie.cache")
@Validated
public class CacheProperties {

    private boolean enabled = true;

    @Positive
    private long textTtlSeconds = 3_600;

    /** SIMPLE answers (greetings, smalltalk) change rarely and live longer. */
    @Positive
    private long simpleTextTtlSeconds = 7_200;

    @Positive
    private long audioTtlSeconds = 7_200;

    /** Entries per cache. New fingerprints are not stored once reached, until the sweep frees room. */
    @Positive
    private int maxEntries = 1_000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getTextTtlSeconds() {
        return textTtlSeconds;
    }

    public void setTextTtlSeconds(long textTtlSeconds) {
        this.textTtlSeconds = textTtlSeconds;
    }

    public long getSimpleTextTtlSeconds() {
        return simpleTextTtlSeconds;
    }

    public void setSimpleTextTtlSeconds(long simpleTextTtlSeconds) {
        this.simpleTextTtlSeconds = simpleTextTtlSeconds;
    }

    public long getAudioTtlSeconds() {
        return audioTtlSeconds;
    }

    public void setAudioTtlSeconds(long audioTtlSeconds) {
        this.audioTtlSeconds = audioTtlSeconds;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public Duration textTtl() {
        return Duration.ofSeconds(textTtlSeconds);
    }

    public Duration simpleTextTtl() {
        return Duration.ofSeconds(simpleTextTtlSeconds);
    }

    public Duration audioTtl() {
        return Duration.ofSeconds(audioTtlSeconds);
    }
}
