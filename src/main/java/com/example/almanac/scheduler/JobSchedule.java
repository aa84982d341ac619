package com.example.almanac.scheduler;

import com.example.almanac.common.ConfigException;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;

/**
 * When a job fires: {@code CRON(expr)}, {@code INTERVAL(seconds)} or {@code ONCE(timestamp)}.
 * Only the value belonging to {@link #type} is meaningful.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSchedule {

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_type", nullable = false)
    private ScheduleType type;

    @Column(name = "cron_expression")
    private String cronExpression;

    @Column(name = "interval_seconds")
    private Long intervalSeconds;

    @Column(name = "run_at")
    private Instant runAt;

    /** Zone the cron fields are evaluated in; UTC when empty. */
    @Column(name = "timezone")
    private String timezone;

    public static JobSchedule cron(String expression) {
        return JobSchedule.builder().type(ScheduleType.CRON).cronExpression(expression).build();
    }

    public static JobSchedule interval(long seconds) {
        return JobSchedule.builder().type(ScheduleType.INTERVAL).intervalSeconds(seconds).build();
    }

    public static JobSchedule once(Instant at) {
        return JobSchedule.builder().type(ScheduleType.ONCE).runAt(at).build();
    }

    /**
     * @throws ConfigException if the schedule cannot be evaluated
     */
    public void validate() {
        if (type == null) {
            throw new ConfigException("Schedule type is required (CRON, INTERVAL or ONCE)");
        }
        switch (type) {
            case CRON -> {
                CronExpression.parse(cronExpression);
                zone();
            }
            case INTERVAL -> {
                if (intervalSeconds == null || intervalSeconds <= 0) {
                    throw new ConfigException("Interval schedule needs a positive intervalSeconds");
                }
            }
            case ONCE -> {
                if (runAt == null) {
                    throw new ConfigException("One-shot schedule needs a runAt timestamp");
                }
            }
        }
    }

    /**
     * First fire time for a freshly created or re-enabled job. A one-shot keeps its timestamp
     * even when it already lies in the past so it still runs once.
     */
    public Instant firstRunAt(Instant now) {
        return switch (type) {
            case CRON -> CronExpression.parse(cronExpression).next(now, zone());
            case INTERVAL -> now.plusSeconds(intervalSeconds);
            case ONCE -> runAt;
        };
    }

    /**
     * Fire time following a run that completed at {@code now}. Intervals count from completion,
     * not from the previous fire, so a late loop never produces catch-up bursts.
     */
    public Instant nextRunAfter(Instant now) {
        return switch (type) {
            case CRON -> CronExpression.parse(cronExpression).next(now, zone());
            case INTERVAL -> now.plusSeconds(intervalSeconds);
            case ONCE -> null;
        };
    }

    public String describe() {
        if (type == null) return "unscheduled";
        return switch (type) {
            case CRON -> "cron '" + cronExpression + "'" + (timezone != null && !timezone.isBlank() ? " " + timezone : "");
            case INTERVAL -> "every " + intervalSeconds + "s";
            case ONCE -> "once at " + runAt;
        };
    }

    private ZoneId zone() {
        if (timezone == null || timezone.isBlank()) return ZoneId.of("UTC");
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ConfigException("Unknown timezone '" + timezone + "'", e);
        }
    }
}
