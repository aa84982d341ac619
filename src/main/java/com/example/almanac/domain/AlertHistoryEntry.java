package com.example.almanac.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One firing episode of a rule, from CLEAR to FIRING and back.
 */
@Entity
@Table(name = "alert_history", indexes = {
        @Index(name = "idx_alert_history_rule", columnList = "rule_id, resolved")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "rule_id", nullable = false)
    private String ruleId;

    @Column(name = "rule_name")
    private String ruleName;

    @Column(name = "fired_at", nullable = false)
    private Instant firedAt;

    @Column(length = 2048)
    private String message;

    @Column(name = "fire_count")
    @Builder.Default
    private int fireCount = 1;

    @Column(name = "notifications_sent")
    @Builder.Default
    private int notificationsSent = 0;

    private boolean resolved;

    @Column(name = "resolved_at")
    private Instant resolvedAt;
}
