package com.example.almanac.domain;

import com.example.almanac.action.JobAction;
import com.example.almanac.action.OutcomeStatus;
import com.example.almanac.scheduler.JobSchedule;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A scheduled job: when it fires ({@link JobSchedule}) and what it does ({@link JobAction}).
 */
@Entity
@Table(name = "jobs", indexes = {
        @Index(name = "idx_jobs_due", columnList = "enabled, next_run_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Job {

    /** Stable id; clients may choose it, otherwise a UUID is assigned. */
    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(length = 2048)
    private String description;

    @Embedded
    private JobSchedule schedule;

    @Embedded
    private JobAction action;

    private boolean enabled;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    /** Null while disabled. */
    @Column(name = "next_run_at")
    private Instant nextRunAt;

    @Column(name = "run_count")
    @Builder.Default
    private long runCount = 0;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "job_tags", joinColumns = @JoinColumn(name = "job_id"))
    @Column(name = "tag")
    @Builder.Default
    private Set<String> tags = new HashSet<>();

    /** Who created the job, e.g. "api" or the name of another platform process. */
    private String source;

    @Column(name = "created_at")
    private Instant createdAt;

    /** Set while a run is in flight; a value found at startup means the run was cut short. */
    @Column(name = "run_started_at")
    private Instant runStartedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_outcome")
    private OutcomeStatus lastOutcome;

    @PrePersist
    protected void onCreate() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (createdAt == null) createdAt = Instant.now();
    }
}
