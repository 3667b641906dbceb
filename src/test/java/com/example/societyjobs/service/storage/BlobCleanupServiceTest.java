package com.example.societyjobs.service.storage;

import com.example.societyjobs.config.JobEngineProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BlobCleanupService Tests")
class BlobCleanupServiceTest {

    private ExecutorService pool;
    private JobEngineProperties properties;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(16);
        properties = new JobEngineProperties();
        properties.getCleanup().setMaxConcurrentDeletes(5);
        properties.getCleanup().setChunkPauseMs(0);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static List<String> urls(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> "https://res.cloudinary.com/demo/raw/upload/v1/requests/r" + i + ".pdf")
                .toList();
    }

    /**
     * Transport that tracks how many deletes overlap.
     */
    private static class CountingTransport implements BlobDeletionTransport {

        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxInFlight = new AtomicInteger();
        private final AtomicInteger attempts = new AtomicInteger();
        private final Set<String> refused = ConcurrentHashMap.newKeySet();
        private final Set<String> broken = ConcurrentHashMap.newKeySet();

        @Override
        public boolean deleteBlob(String url) {
            attempts.incrementAndGet();
            var current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            try {
                Thread.sleep(10);
                if (broken.contains(url)) {
                    throw new IllegalStateException("storage unreachable");
                }
                return !refused.contains(url);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } finally {
                inFlight.decrementAndGet();
            }
        }
    }

    @Test
    @DisplayName("Should never have more deletes in flight than the configured limit")
    void shouldBoundConcurrency() {
        // Given
        var transport = new CountingTransport();
        var service = new BlobCleanupService(transport, pool, properties);

        // When
        var summary = service.deleteAll(urls(23));

        // Then
        assertThat(transport.maxInFlight.get()).isBetween(1, 5);
        assertThat(transport.attempts).hasValue(23);
        assertThat(summary.getAttempted()).isEqualTo(23);
        assertThat(summary.getDeleted()).isEqualTo(23);
        assertThat(summary.getErrors()).isEmpty();
    }

    @Test
    @DisplayName("Should collect refusals and exceptions without stopping")
    void shouldCollectFailures() {
        // Given
        var all = urls(12);
        var transport = new CountingTransport();
        transport.refused.add(all.get(3));
        transport.broken.add(all.get(9));
        var service = new BlobCleanupService(transport, pool, properties);

        // When
        var summary = service.deleteAll(all);

        // Then
        assertThat(transport.attempts).hasValue(12);
        assertThat(summary.getDeleted()).isEqualTo(10);
        assertThat(summary.getFailed()).isEqualTo(2);
        assertThat(summary.getErrors()).containsExactlyInAnyOrder(
                "blob " + all.get(3) + ": not deleted",
                "blob " + all.get(9) + ": storage unreachable");
    }

    @Test
    @DisplayName("Should return an empty summary for no URLs")
    void shouldHandleNoUrls() {
        var transport = new CountingTransport();
        var service = new BlobCleanupService(transport, pool, properties);

        assertThat(service.deleteAll(List.of())).isEqualTo(BlobDeletionSummary.empty());
        assertThat(transport.attempts).hasValue(0);
    }
}
