package com.example.societyjobs.domain.enums;

public enum MeetingStatus {
    SCHEDULED,
    LIVE,
    ENDED,
    CANCELLED
}
