package com.phillippitts.ellie.service.cache;

import com.phillippitts.ellie.exception.CacheException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryResponseCacheTest {

    private MutableClock clock;
    private InMemoryResponseCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        cache = new InMemoryResponseCache<>("text", 3, clock);
    }

    @Test
    void returnsStoredValueUntilTtlElapses() {
        cache.put("k", "hello", Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(9));
        assertThat(cache.get("k")).contains("hello");

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("k")).isEmpty();
    }

    @Test
    void firstWriterWinsWhileEntryIsLive() {
        assertThat(cache.put("k", "first", Duration.ofMinutes(1))).isEqualTo("first");
        assertThat(cache.put("k", "second", Duration.ofMinutes(1))).isEqualTo("first");
        assertThat(cache.get("k")).contains("first");
    }

    @Test
    void expiredEntryIsReplacedByNextPut() {
        cache.put("k", "old", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        assertThat(cache.put("k", "new", Duration.ofSeconds(5))).isEqualTo("new");
        assertThat(cache.get("k")).contains("new");
    }

    @Test
    void doesNotGrowPastMaxEntries() {
        cache.put("a", "1", Duration.ofMinutes(1));
        cache.put("b", "2", Duration.ofMinutes(1));
        cache.put("c", "3", Duration.ofMinutes(1));
        cache.put("d", "4", Duration.ofMinutes(1));

        assertThat(cache.stats().size()).isEqualTo(3);
        assertThat(cache.get("d")).isEmpty();
    }

    @Test
    void evictExpiredRemovesOnlyDeadEntries() {
        cache.put("short", "x", Duration.ofSeconds(1));
        cache.put("long", "y", Duration.ofMinutes(1));
        clock.advance(Duration.ofSeconds(5));

        assertThat(cache.evictExpired()).isEqualTo(1);
        assertThat(cache.get("long")).contains("y");
    }

    @Test
    void tracksHitsAndMisses() {
        cache.put("k", "v", Duration.ofMinutes(1));
        cache.get("k");
        cache.get("k");
        cache.get("missing");

        CacheStats stats = cache.stats();
        assertThat(stats.hits()).isEqualTo(2);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRate()).isCloseTo(0.666, org.assertj.core.data.Offset.offset(0.01));
    }

    @Test
    void clearDropsEverything() {
        cache.put("k", "v", Duration.ofMinutes(1));
        cache.clear();
        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.stats().size()).isZero();
    }

    @Test
    void rejectsBlankFingerprintNullValueAndNonPositiveTtl() {
        assertThatThrownBy(() -> cache.get(" ")).isInstanceOf(CacheException.class);
        assertThatThrownBy(() -> cache.put("k", null, Duration.ofSeconds(1))).isInstanceOf(CacheException.class);
        assertThatThrownBy(() -> cache.put("k", "v", Duration.ZERO)).isInstanceOf(CacheException.class);
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
