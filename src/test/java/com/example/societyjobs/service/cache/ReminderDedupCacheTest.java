package com.example.societyjobs.service.cache;

import com.example.societyjobs.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReminderDedupCache Tests")
class ReminderDedupCacheTest {

    private static final Duration TTL = Duration.ofMinutes(120);

    private MutableClock clock;
    private ReminderDedupCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        cache = new ReminderDedupCache(clock);
        cache.init();
    }

    @Test
    @DisplayName("Should build key from entity id and threshold")
    void shouldBuildKey() {
        var id = UUID.fromString("00000000-0000-0000-0000-000000000042");

        assertThat(ReminderDedupCache.key(id, 60)).isEqualTo("00000000-0000-0000-0000-000000000042_60");
    }

    @Nested
    @DisplayName("markIfAbsent Tests")
    class MarkIfAbsentTests {

        @Test
        @DisplayName("Should insert once and refuse a live duplicate")
        void shouldInsertOnce() {
            assertThat(cache.markIfAbsent("e1_60", TTL)).isTrue();
            assertThat(cache.markIfAbsent("e1_60", TTL)).isFalse();
            assertThat(cache.contains("e1_60")).isTrue();
            assertThat(cache.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should replace an expired marker")
        void shouldReplaceExpiredMarker() {
            cache.markIfAbsent("e1_60", TTL);
            clock.advance(TTL.plusSeconds(1));

            assertThat(cache.markIfAbsent("e1_60", TTL)).isTrue();
        }

        @Test
        @DisplayName("Should let exactly one of many concurrent callers win")
        void shouldLetOneConcurrentCallerWin() throws Exception {
            var threads = 8;
            var pool = Executors.newFixedThreadPool(threads);
            var start = new CountDownLatch(1);
            var winners = new AtomicInteger();
            try {
                for (var i = 0; i < threads; i++) {
                    pool.submit(() -> {
                        start.await();
                        if (cache.markIfAbsent("e2_15", TTL)) {
                            winners.incrementAndGet();
                        }
                        return null;
                    });
                }
                start.countDown();
            } finally {
                pool.shutdown();
                assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
            }

            assertThat(winners.get()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Expiry Tests")
    class ExpiryTests {

        @Test
        @DisplayName("Should still hold a marker exactly at its expiry instant")
        void shouldHoldMarkerAtExpiryInstant() {
            cache.markIfAbsent("e1_5", TTL);
            clock.advance(TTL);

            assertThat(cache.contains("e1_5")).isTrue();
        }

        @Test
        @DisplayName("Should remove expired marker on lookup")
        void shouldRemoveExpiredMarkerOnLookup() {
            cache.markIfAbsent("e1_5", TTL);
            clock.advance(TTL.plusMillis(1));

            assertThat(cache.contains("e1_5")).isFalse();
            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("Should sweep only expired markers")
        void shouldSweepOnlyExpiredMarkers() {
            cache.markIfAbsent("old_60", TTL);
            clock.advance(Duration.ofMinutes(90));
            cache.markIfAbsent("new_60", TTL);
            clock.advance(Duration.ofMinutes(31));

            var removed = cache.sweepExpired();

            assertThat(removed).isEqualTo(1);
            assertThat(cache.contains("old_60")).isFalse();
            assertThat(cache.contains("new_60")).isTrue();
        }
    }

    @Test
    @DisplayName("Should drop all markers on shutdown")
    void shouldDropAllMarkersOnShutdown() {
        cache.markIfAbsent("a_5", TTL);
        cache.markIfAbsent("b_5", TTL);

        cache.shutdown();

        assertThat(cache.size()).isZero();
    }
}
