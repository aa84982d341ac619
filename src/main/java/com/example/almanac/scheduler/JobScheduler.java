package com.example.almanac.scheduler;

import com.example.almanac.action.ActionContext;
import com.example.almanac.action.ActionExecutor;
import com.example.almanac.action.Outcome;
import com.example.almanac.config.AlmanacProperties;
import com.example.almanac.domain.Job;
import com.example.almanac.eventlog.EventLevel;
import com.example.almanac.eventlog.EventLogService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Timing loop of the job store.
 *
 * Each tick hands the due jobs to the job pool. A job id stays in the running set from dispatch
 * until its run has been advanced, so a slow job is skipped by later ticks instead of piling up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobScheduler {

    private final JobStore jobStore;
    private final ActionExecutor actionExecutor;
    private final EventLogService eventLogService;
    private final AlmanacProperties properties;
    @Qualifier("jobExecutor")
    private final Executor jobExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Set<String> running = ConcurrentHashMap.newKeySet();

    @Scheduled(fixedDelayString = "${almanac.scheduler.tick-millis:5000}", initialDelay = 1000)
    public void tick() {
        if (!properties.getScheduler().isEnabled()) return;
        try {
            runDueJobs(clock.instant());
        } catch (Exception e) {
            log.error("Scheduler tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Dispatch every job due at {@code now} that is not already running.
     *
     * @return number of jobs handed to the pool
     */
    public int runDueJobs(Instant now) {
        List<Job> due = jobStore.dueJobs(now);
        int dispatched = 0;
        for (Job job : due) {
            if (running.contains(job.getId())) {
                log.debug("Job {} is still running, skipping this tick", job.getId());
                continue;
            }
            if (dispatch(job.getId(), false)) {
                dispatched++;
            }
        }
        return dispatched;
    }

    /**
     * Run a job now regardless of {@code nextRunAt}. The overlap guard still applies.
     */
    public TriggerResult triggerNow(String jobId) {
        if (jobStore.get(jobId).isEmpty()) {
            return TriggerResult.NOT_FOUND;
        }
        if (!dispatch(jobId, true)) {
            return TriggerResult.ALREADY_RUNNING;
        }
        log.info("Manual run of job {} started", jobId);
        return TriggerResult.STARTED;
    }

    public boolean isRunning(String jobId) {
        return running.contains(jobId);
    }

    public Set<String> runningJobs() {
        return Set.copyOf(running);
    }

    private boolean dispatch(String jobId, boolean manual) {
        if (!running.add(jobId)) {
            return false;
        }
        try {
            jobExecutor.execute(() -> runJob(jobId, manual));
            return true;
        } catch (RejectedExecutionException e) {
            running.remove(jobId);
            log.warn("Job pool is full, job {} will be retried next tick", jobId);
            return false;
        }
    }

    void runJob(String jobId, boolean manual) {
        try {
            Optional<Job> claimed = jobStore.claim(jobId, clock.instant(), manual);
            if (claimed.isEmpty()) {
                log.debug("Job {} is gone or no longer due, not running", jobId);
                return;
            }
            Job job = claimed.get();
            ActionContext context = new ActionContext(job.getId(), job.getName(), job.getRunCount() + 1,
                    job.getRunStartedAt(), manual);

            Outcome outcome;
            try {
                outcome = actionExecutor.execute(job.getAction(), context);
            } catch (Exception e) {
                log.error("Action executor failed for job {}", jobId, e);
                outcome = Outcome.error(e.getClass().getSimpleName() + ": " + e.getMessage(), null);
            }
            meterRegistry.counter("almanac.job.runs",
                    "outcome", outcome.status().name().toLowerCase(),
                    "trigger", manual ? "manual" : "schedule").increment();
            meterRegistry.timer("almanac.job.duration", "action", job.getAction().getType().name().toLowerCase())
                    .record(outcome.duration());

            jobStore.advance(jobId, clock.instant(), outcome);
        } catch (Exception e) {
            log.error("Run of job {} could not be recorded: {}", jobId, e.getMessage(), e);
        } finally {
            running.remove(jobId);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getScheduler().isRecoverOnStartup()) {
            recoverInterrupted(clock.instant());
        }
        List<Job> enabled = jobStore.enabledJobs();
        log.info("Scheduler started with {} enabled job(s)", enabled.size());
        for (Job job : enabled) {
            log.info("  {} '{}' ({}) next run {}", job.getId(), job.getName(),
                    job.getSchedule().describe(), job.getNextRunAt());
        }
    }

    /**
     * Advance every job whose last run never finished (the process died mid-run) with an
     * INTERRUPTED outcome, so a one-shot job does not fire a second time.
     *
     * @return number of jobs recovered
     */
    public int recoverInterrupted(Instant now) {
        int recovered = 0;
        for (Job job : jobStore.interruptedJobs()) {
            if (running.contains(job.getId())) continue;
            Outcome outcome = Outcome.interrupted("Run started at " + job.getRunStartedAt() + " did not finish");
            jobStore.advance(job.getId(), now, outcome);

            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("job_id", job.getId());
            fields.put("job_name", job.getName());
            fields.put("run", job.getRunCount() + 1);
            fields.put("run_started_at", String.valueOf(job.getRunStartedAt()));
            fields.putAll(outcome.toEventFields());
            eventLogService.append(EventLevel.WARNING, ActionExecutor.EVENT_SOURCE,
                    String.format("Job '%s' run %d interrupted", job.getName(), job.getRunCount() + 1), fields);
            log.warn("Recovered interrupted run of job {} (started {})", job.getId(), job.getRunStartedAt());
            recovered++;
        }
        return recovered;
    }
}
