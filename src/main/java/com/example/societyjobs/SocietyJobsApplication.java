package com.example.societyjobs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Society Jobs Application
 * <p>
 * Background job engine for the society membership and event platform.
 * Keeps derived platform state consistent without a central transaction coordinator.
 * <p>
 * Features:
 * - Per-job run guard so no job ever runs twice in parallel
 * - Bounded retry with fixed delay and Slack alerting once retries are exhausted
 * - Paginated stale record cleanup with bounded-concurrency blob deletion
 * - Scheduled publishing of events and announcements with per-item isolation
 * - Deduplicated event-start reminders backed by an in-memory TTL cache
 */
@EnableScheduling
@SpringBootApplication
public class SocietyJobsApplication {

    public static void main(String[] args) {
        SpringApplication.run(SocietyJobsApplication.class, args);
    }
}
