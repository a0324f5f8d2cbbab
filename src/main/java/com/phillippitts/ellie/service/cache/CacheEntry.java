package com.phillippitts.ellie.service.cache;

import java.time.Instant;

/**
 * Immutable cache slot.
 */
record CacheEntry<T>(String fingerprint, T value, Instant createdAt, Instant expiresAt) {

    boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
