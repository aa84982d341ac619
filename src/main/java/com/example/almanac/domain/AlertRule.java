package com.example.almanac.domain;

import com.example.almanac.alert.AlertPredicate;
import com.example.almanac.alert.FireAction;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Defines an alerting rule evaluated against the event log, an HTTP endpoint, a PID file or a
 * directory.
 */
@Entity
@Table(name = "alert_rules")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(length = 2048)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AlertPredicate predicate;

    /** Event-source prefix the predicate reads, e.g. "herald". */
    private String source;

    /** Structured field read by METRIC_ABOVE. */
    @Column(name = "metric_field")
    private String metricField;

    @Column(name = "endpoint_url", length = 2048)
    private String endpointUrl;

    /** PID file read by PROCESS_DOWN; a leading "~" is the user's home. */
    @Column(name = "pid_file", length = 1024)
    private String pidFile;

    /** Directory measured by DISK_USAGE_ABOVE. */
    @Column(name = "path", length = 1024)
    private String path;

    @Column(name = "window_seconds")
    @Builder.Default
    private int windowSeconds = 300;

    @Builder.Default
    private double threshold = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_on_fire", nullable = false)
    @Builder.Default
    private FireAction actionOnFire = FireAction.NOTIFY;

    /** Key into the configured processes; required for RESTART_AND_NOTIFY. */
    @Column(name = "process_name")
    private String processName;

    @Column(name = "cooldown_seconds")
    @Builder.Default
    private int cooldownSeconds = 900;

    /** Overrides the default notification channel when set. */
    @Column(name = "notify_channel")
    private String notifyChannel;

    @Column(name = "notify_target")
    private String notifyTarget;

    @Builder.Default
    private boolean enabled = true;

    @Column(name = "created_at")
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
