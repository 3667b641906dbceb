package com.example.societyjobs.domain.entity;

import com.example.societyjobs.domain.enums.EventAudience;
import com.example.societyjobs.domain.enums.Visibility;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A society announcement. Its status column carries the same
 * Draft/Schedule/Publish visibility as events.
 */
@Entity
@Table(name = "announcements", indexes = {
        @Index(name = "idx_announcement_status_publish_at", columnList = "status, publish_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Announcement {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "society_id", nullable = false)
    private UUID societyId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "content", columnDefinition = "TEXT")
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private Visibility status = Visibility.DRAFT;

    @Enumerated(EnumType.STRING)
    @Column(name = "audience", nullable = false, length = 20)
    @Builder.Default
    private EventAudience audience = EventAudience.MEMBERS;

    /**
     * Whether recipients also get an e-mail copy
     */
    @Column(name = "send_email", nullable = false)
    @Builder.Default
    private boolean sendEmail = false;

    @Column(name = "publish_at")
    private Instant publishAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
