package com.example.societyjobs.domain.entity;

import com.example.societyjobs.domain.enums.EventAudience;
import com.example.societyjobs.domain.enums.EventStatus;
import com.example.societyjobs.domain.enums.Visibility;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A society event.
 * <p>
 * The job engine reads and writes only the scheduling-related columns:
 * visibility and publish time for deferred publishing, status and the
 * start/end window for lifecycle transitions and reminders.
 */
@Entity
@Table(name = "events", indexes = {
        @Index(name = "idx_event_visibility_publish_at", columnList = "visibility, publish_at"),
        @Index(name = "idx_event_status_starts_at", columnList = "status, starts_at"),
        @Index(name = "idx_event_status_ends_at", columnList = "status, ends_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Event {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "society_id", nullable = false)
    private UUID societyId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    /**
     * Banner image URL, used as the notification image
     */
    @Column(name = "banner", length = 500)
    private String banner;

    @Enumerated(EnumType.STRING)
    @Column(name = "visibility", nullable = false, length = 20)
    @Builder.Default
    private Visibility visibility = Visibility.DRAFT;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private EventStatus status = EventStatus.UPCOMING;

    @Enumerated(EnumType.STRING)
    @Column(name = "audience", nullable = false, length = 20)
    @Builder.Default
    private EventAudience audience = EventAudience.OPEN;

    @Column(name = "is_draft", nullable = false)
    @Builder.Default
    private boolean draft = false;

    /**
     * When a SCHEDULE event becomes visible
     */
    @Column(name = "publish_at")
    private Instant publishAt;

    @Column(name = "starts_at")
    private Instant startsAt;

    @Column(name = "ends_at")
    private Instant endsAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
