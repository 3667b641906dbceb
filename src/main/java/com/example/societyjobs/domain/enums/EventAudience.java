package com.example.societyjobs.domain.enums;

/**
 * Who is told about a newly published item.
 */
public enum EventAudience {

    /**
     * Every student on the platform
     */
    OPEN,

    /**
     * Members of the owning society
     */
    MEMBERS,

    /**
     * Invited students only; no broadcast on publish
     */
    INVITE
}
