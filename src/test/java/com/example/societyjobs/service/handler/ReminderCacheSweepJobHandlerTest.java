package com.example.societyjobs.service.handler;

import com.example.societyjobs.service.cache.ReminderDedupCache;
import com.example.societyjobs.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReminderCacheSweepJobHandler Tests")
class ReminderCacheSweepJobHandlerTest {

    private MutableClock clock;
    private ReminderDedupCache cache;
    private ReminderCacheSweepJobHandler handler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        cache = new ReminderDedupCache(clock);
        cache.init();
        handler = new ReminderCacheSweepJobHandler(cache);
    }

    @Test
    @DisplayName("Should remove only expired markers and report what remains")
    void shouldSweepExpiredMarkers() {
        // Given
        cache.markIfAbsent("a_60", Duration.ofMinutes(30));
        cache.markIfAbsent("b_60", Duration.ofMinutes(30));
        cache.markIfAbsent("c_60", Duration.ofMinutes(120));
        clock.advance(Duration.ofMinutes(45));

        // When
        var result = handler.execute();

        // Then
        assertThat(result.getTotalProcessed()).isEqualTo(2);
        assertThat(result.getDetails()).containsEntry("remaining", 1);
        assertThat(cache.contains("c_60")).isTrue();
    }

    @Test
    @DisplayName("Should be a no-op on an empty cache")
    void shouldHandleEmptyCache() {
        var result = handler.execute();

        assertThat(result.getTotalProcessed()).isZero();
        assertThat(result.getDetails()).containsEntry("remaining", 0);
    }
}
