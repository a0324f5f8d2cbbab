package com.phillippitts.ellie.client.transport;

import com.phillippitts.ellie.config.properties.ClientProperties;

import java.time.Duration;

/**
 * Exponential reconnect backoff: {@code initial * multiplier^(n-1)}, capped at {@code max}, for
 * attempts {@code 1..maxAttempts}.
 */
public record BackoffPolicy(Duration initial, Duration max, double multiplier, int maxAttempts) {

    public BackoffPolicy {
        if (initial.isNegative() || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("Require 0 <= initial <= max");
        }
        if (multiplier < 1.0 || maxAttempts < 0) {
            throw new IllegalArgumentException("Require multiplier >= 1 and maxAttempts >= 0");
        }
    }

    public static BackoffPolicy from(ClientProperties.Reconnect props) {
        return new BackoffPolicy(Duration.ofMillis(props.getInitialDelayMs()), Duration.ofMillis(props.getMaxDelayMs()),
                props.getMultiplier(), props.getMaxAttempts());
    }

    /**
     * @param attempt 1-based attempt number
     */
    public Duration delayBefore(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based");
        }
        double millis = initial.toMillis() * Math.pow(multiplier, attempt - 1);
        return millis >= max.toMillis() ? max : Duration.ofMillis((long) millis);
    }

    public boolean allows(int attempt) {
        return attempt >= 1 && attempt <= maxAttempts;
    }
}
