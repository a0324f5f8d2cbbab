package com.phillippitts.ellie.service.cache;

import com.phillippitts.ellie.exception.CacheException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * {@link ResponseCache} backed by a {@link ConcurrentHashMap}.
 *
 * <p>First writer wins: {@link #put} only replaces a missing or expired entry, atomically per key.
 * Expiry is checked on read and by the scheduled sweep in {@link CacheMaintenance}. When
 * {@code maxEntries} is reached new fingerprints are not stored until the sweep frees room.
 */
public class InMemoryResponseCache<T> implements ResponseCache<T> {

    private static final Logger LOG = LogManager.getLogger(InMemoryResponseCache.class);

    private final String name;
    private final int maxEntries;
    private final Clock clock;
    private final ConcurrentMap<String, CacheEntry<T>> entries = new ConcurrentHashMap<>();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public InMemoryResponseCache(String name, int maxEntries) {
        this(name, maxEntries, Clock.systemUTC());
    }

    // Package-private for tests
    InMemoryResponseCache(String name, int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got: " + maxEntries);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.maxEntries = maxEntries;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<T> get(String fingerprint) {
        requireFingerprint(fingerprint);
        CacheEntry<T> entry = entries.get(fingerprint);
        if (entry == null) {
            misses.increment();
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(fingerprint, entry);
            misses.increment();
            return Optional.empty();
        }
        hits.increment();
        return Optional.of(entry.value());
    }

    @Override
    public T put(String fingerprint, T value, Duration ttl) {
        requireFingerprint(fingerprint);
        if (value == null) {
            throw new CacheException("Refusing to cache null value in " + name, fingerprint, null);
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new CacheException("TTL must be positive in " + name + ", got: " + ttl, fingerprint, null);
        }
        Instant now = clock.instant();
        if (entries.size() >= maxEntries && !entries.containsKey(fingerprint)) {
            LOG.debug("Cache {} full ({} entries); not storing {}", name, maxEntries, fingerprint);
            return value;
        }
        CacheEntry<T> retained = entries.compute(fingerprint, (key, existing) ->
                existing == null || existing.isExpired(now)
                        ? new CacheEntry<>(key, value, now, now.plus(ttl))
                        : existing);
        return retained.value();
    }

    @Override
    public int evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(e -> e.isExpired(now));
        return Math.max(0, before - entries.size());
    }

    @Override
    public void clear() {
        entries.clear();
        LOG.info("Cache {} cleared", name);
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(name, entries.size(), hits.sum(), misses.sum());
    }

    private void requireFingerprint(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new CacheException("Fingerprint must not be blank in " + name, fingerprint, null);
        }
    }
}
