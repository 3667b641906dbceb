package com.example.societyjobs.service.cache;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Marker that a reminder was already sent, valid for its TTL.
 */
@Value
public class ReminderCacheEntry {

    Instant insertedAt;
    Duration ttl;

    public Instant getExpiresAt() {
        return insertedAt.plus(ttl);
    }

    /**
     * An entry still counts at exactly insertedAt + ttl and is gone strictly after it
     */
    public boolean isExpiredAt(Instant now) {
        return now.isAfter(getExpiresAt());
    }
}
