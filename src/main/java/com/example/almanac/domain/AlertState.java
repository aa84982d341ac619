package com.example.almanac.domain;

import com.example.almanac.alert.AlertStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Runtime state of one rule, including the circuit breaker. Persisted so a restart of the
 * service neither re-notifies a known alert nor forgets that a rule was suppressed.
 */
@Entity
@Table(name = "alert_state")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertState {

    @Id
    @Column(name = "rule_id")
    private String ruleId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private AlertStatus status = AlertStatus.CLEAR;

    @Column(name = "fired_at")
    private Instant firedAt;

    @Column(name = "consecutive_fires")
    @Builder.Default
    private int consecutiveFires = 0;

    /** Set once consecutiveFires reaches the breaker ceiling, cleared on the way back to CLEAR. */
    @Builder.Default
    private boolean suppressed = false;

    /** Last firing notification; cooldown counts from here. */
    @Column(name = "last_notified_at")
    private Instant lastNotifiedAt;

    @Column(name = "last_evaluated_at")
    private Instant lastEvaluatedAt;

    @Column(name = "last_message", length = 2048)
    private String lastMessage;

    @Column(name = "cleared_at")
    private Instant clearedAt;

    public static AlertState clear(String ruleId) {
        return AlertState.builder().ruleId(ruleId).build();
    }
}
