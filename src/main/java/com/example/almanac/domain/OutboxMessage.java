package com.example.almanac.domain;

import com.example.almanac.outbox.OutboxStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A queued notification. Rows are never deleted; a message ends either SENT or FAILED.
 */
@Entity
@Table(name = "outbox", indexes = {
        @Index(name = "idx_outbox_status_next", columnList = "status, next_attempt_at"),
        @Index(name = "idx_outbox_lane", columnList = "channel, target, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxMessage {

    /** Monotonic; defines FIFO order per (channel, target). */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String channel;

    @Column(nullable = false)
    private String target;

    @Column(nullable = false, length = 8192)
    private String body;

    private String sender;

    @Column(name = "dedup_key", unique = true)
    private String dedupKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private OutboxStatus status = OutboxStatus.PENDING;

    @Builder.Default
    private int attempts = 0;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Column(name = "last_error", length = 2048)
    private String lastError;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (nextAttemptAt == null) nextAttemptAt = createdAt;
    }
}
