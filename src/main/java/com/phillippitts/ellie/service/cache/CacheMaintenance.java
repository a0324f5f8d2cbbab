package com.phillippitts.ellie.service.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodically evicts expired entries from every {@link ResponseCache} bean and exposes the
 * stats and clear operations used by the cache management endpoints.
 */
@Component
public class CacheMaintenance {

    private static final Logger LOG = LogManager.getLogger(CacheMaintenance.class);

    private final List<ResponseCache<?>> caches;

    public CacheMaintenance(List<ResponseCache<?>> caches) {
        this.caches = List.copyOf(caches);
    }

    @Scheduled(fixedDelayString = "${ellie.cache.sweep-interval-ms:60000}")
    public void sweep() {
        int removed = 0;
        for (ResponseCache<?> cache : caches) {
            removed += cache.evictExpired();
        }
        if (removed > 0) {
            LOG.debug("Cache sweep removed {} expired entries", removed);
        }
    }

    public List<CacheStats> stats() {
        return caches.stream().map(ResponseCache::stats).toList();
    }

    public void clearAll() {
        caches.forEach(ResponseCache::clear);
    }
}
