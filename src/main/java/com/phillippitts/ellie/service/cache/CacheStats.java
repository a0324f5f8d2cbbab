package com.phillippitts.ellie.service.cache;

/**
 * Point-in-time counters of one cache, exposed at {@code /api/cache/stats}.
 */
public record CacheStats(String name, int size, long hits, long misses) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
