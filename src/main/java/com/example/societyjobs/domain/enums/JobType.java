package com.example.societyjobs.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The recurring jobs known to the engine.
 * The code is the job name used by the registry, the triggers and the manual trigger API.
 */
@Getter
@RequiredArgsConstructor
public enum JobType {

    /**
     * Purge expired reminder markers from the dedup cache
     */
    REMINDER_CACHE_SWEEP("reminder-cache-sweep"),

    /**
     * Delete processed join requests (and their PDFs), finished meetings and dead push tokens
     */
    STALE_RECORD_CLEANUP("stale-record-cleanup"),

    /**
     * Publish events and announcements whose publish time has passed
     */
    SCHEDULED_PUBLISHING("scheduled-publishing"),

    /**
     * Move events through Upcoming, Ongoing and Completed
     */
    EVENT_STATUS_UPDATE("event-status-update"),

    /**
     * Send event-start reminders to registered students
     */
    EVENT_REMINDERS("event-reminders");

    private final String code;
}
