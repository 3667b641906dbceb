package com.example.societyjobs.service.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory TTL keyed set of "reminder already sent" markers.
 * <p>
 * Keys are {@code entityId + "_" + thresholdMinutes}. Expired entries are
 * removed lazily when looked up and proactively by {@link #sweepExpired()}.
 * Contents are lost on restart, so deduplication is best-effort across
 * process lifetimes.
 * <p>
 * Lifecycle is explicit: {@link #init()} at startup and {@link #shutdown()}
 * on exit, both driven by JobManagementService.
 */
@Slf4j
@Component
public class ReminderDedupCache {

    private final Map<String, ReminderCacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public ReminderDedupCache(Clock clock) {
        this.clock = clock;
    }

    public static String key(Object entityId, int thresholdMinutes) {
        return entityId + "_" + thresholdMinutes;
    }

    public void init() {
        entries.clear();
        log.info("Reminder dedup cache initialized");
    }

    public void shutdown() {
        var dropped = entries.size();
        entries.clear();
        log.info("Reminder dedup cache shut down, dropped {} entries", dropped);
    }

    /**
     * Check for a live marker. An expired marker is removed as part of the check.
     */
    public boolean contains(String key) {
        var now = clock.instant();
        return entries.computeIfPresent(key, (k, entry) -> entry.isExpiredAt(now) ? null : entry) != null;
    }

    /**
     * Insert a marker unless a live one exists. Check and insert are a single atomic step,
     * so two overlapping callers can never both win for the same key.
     *
     * @return true if this call inserted the marker
     */
    public boolean markIfAbsent(String key, Duration ttl) {
        var now = clock.instant();
        var inserted = new AtomicBoolean(false);
        entries.compute(key, (k, existing) -> {
            if (existing != null && !existing.isExpiredAt(now)) {
                return existing;
            }
            inserted.set(true);
            return new ReminderCacheEntry(now, ttl);
        });
        return inserted.get();
    }

    /**
     * Remove every expired marker.
     *
     * @return number of markers removed
     */
    public int sweepExpired() {
        var now = clock.instant();
        var removed = 0;
        for (var entry : entries.entrySet()) {
            if (entry.getValue().isExpiredAt(now) && entries.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired reminder markers, {} remain", removed, entries.size());
        }
        return removed;
    }

    /**
     * Number of markers held, including expired ones not yet swept
     */
    public int size() {
        return entries.size();
    }
}
