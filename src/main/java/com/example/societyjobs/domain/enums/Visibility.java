package com.example.societyjobs.domain.enums;

/**
 * Visibility of events and announcements.
 * SCHEDULE items become PUBLISH once their publish time has passed.
 */
public enum Visibility {
    DRAFT,
    SCHEDULE,
    PUBLISH
}
