package com.phillippitts.ellie.service.cache;

import com.phillippitts.ellie.exception.CacheException;

import java.time.Duration;
import java.util.Optional;

/**
 * Content-addressed memo of provider output keyed by {@link CacheFingerprints fingerprint}.
 *
 * <p>Entries are write-once: the first {@link #put} for a live fingerprint is retained and later puts
 * return the retained value. Safe for concurrent readers and writers.
 *
 * @param <T> cached value type (reply text or synthesized audio)
 */
public interface ResponseCache<T> {

    /**
     * @return the live value for the fingerprint, or empty on miss or expiry
     * @throws CacheException on internal failure; callers treat it as a miss
     */
    Optional<T> get(String fingerprint);

    /**
     * Stores a value unless a live entry exists.
     *
     * @return the value now associated with the fingerprint (the earlier one if this put lost)
     * @throws CacheException on internal failure; callers ignore it
     */
    T put(String fingerprint, T value, Duration ttl);

    /** Removes expired entries. @return number of entries removed */
    int evictExpired();

    void clear();

    CacheStats stats();
}
