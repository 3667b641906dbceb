package com.example.societyjobs.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A device token registered for push delivery.
 */
@Entity
@Table(name = "push_tokens", indexes = {
        @Index(name = "idx_push_token_active_last_used", columnList = "is_active, last_used_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PushToken {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "student_id", nullable = false)
    private UUID studentId;

    @Column(name = "token", nullable = false, length = 300)
    private String token;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "last_used_at", nullable = false)
    private Instant lastUsedAt;
}
