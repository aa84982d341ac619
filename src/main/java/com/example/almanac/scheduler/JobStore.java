package com.example.almanac.scheduler;

import com.example.almanac.action.Outcome;
import com.example.almanac.common.ConfigException;
import com.example.almanac.common.KeyedLocks;
import com.example.almanac.config.AlmanacProperties;
import com.example.almanac.domain.Job;
import com.example.almanac.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Job definitions and their run bookkeeping. Every write to a job is serialized by job id, so a
 * run completing concurrently with an API update or a toggle never loses either write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStore {

    private final JobRepository repository;
    private final AlmanacProperties properties;
    private final Clock clock;

    private final KeyedLocks locks = new KeyedLocks();

    /** Enabled jobs with {@code nextRunAt <= now}, earliest first, ties by id. */
    public List<Job> dueJobs(Instant now) {
        return repository.findDue(now);
    }

    public List<Job> list(String tag) {
        List<Job> all = repository.findAllByOrderByCreatedAtAsc();
        if (tag == null || tag.isBlank()) return all;
        return all.stream().filter(job -> job.getTags().contains(tag)).toList();
    }

    public Optional<Job> get(String id) {
        return repository.findById(id);
    }

    public List<Job> enabledJobs() {
        return repository.findByEnabledTrueOrderByNextRunAtAsc();
    }

    public List<Job> interruptedJobs() {
        return repository.findByRunStartedAtIsNotNull();
    }

    /**
     * @throws ConfigException if the job is invalid or its id is taken
     */
    public Job create(Job job) {
        validate(job);
        if (job.getId() == null || job.getId().isBlank()) {
            job.setId(UUID.randomUUID().toString());
        } else if (repository.existsById(job.getId())) {
            throw new ConfigException("Job '" + job.getId() + "' already exists");
        }
        Instant now = clock.instant();
        job.setCreatedAt(now);
        job.setRunCount(0);
        job.setLastRunAt(null);
        job.setRunStartedAt(null);
        job.setLastOutcome(null);
        if (job.getTags() == null) job.setTags(new HashSet<>());
        job.setNextRunAt(job.isEnabled() ? job.getSchedule().firstRunAt(now) : null);
        Job saved = repository.save(job);
        log.info("Created job {} '{}' ({}), next run {}", saved.getId(), saved.getName(),
                saved.getSchedule().describe(), saved.getNextRunAt());
        return saved;
    }

    /**
     * Replace name, description, schedule, action and tags with the non-null values of
     * {@code changes}. The enabled flag is only changed through {@link #setEnabled}.
     *
     * @throws ConfigException if the result is invalid
     */
    public Optional<Job> update(String id, Job changes) {
        return locks.withLock(id, () -> repository.findById(id).map(job -> {
            boolean scheduleChanged = changes.getSchedule() != null && !changes.getSchedule().equals(job.getSchedule());
            if (changes.getName() != null) job.setName(changes.getName());
            if (changes.getDescription() != null) job.setDescription(changes.getDescription());
            if (changes.getSchedule() != null) job.setSchedule(changes.getSchedule());
            if (changes.getAction() != null) job.setAction(changes.getAction());
            if (changes.getTags() != null) job.setTags(new HashSet<>(changes.getTags()));
            validate(job);
            if (scheduleChanged && job.isEnabled()) {
                job.setNextRunAt(job.getSchedule().firstRunAt(clock.instant()));
            }
            Job saved = repository.save(job);
            log.info("Updated job {} ({}), next run {}", id, saved.getSchedule().describe(), saved.getNextRunAt());
            return saved;
        }));
    }

    public boolean delete(String id) {
        boolean deleted = locks.withLock(id, () -> {
            if (!repository.existsById(id)) return false;
            repository.deleteById(id);
            return true;
        });
        if (deleted) {
            locks.forget(id);
            log.info("Deleted job {}", id);
        }
        return deleted;
    }

    /**
     * Enabling recomputes {@code nextRunAt}; disabling clears it.
     *
     * @throws ConfigException when re-enabling a one-shot job that already ran
     */
    public Optional<Job> setEnabled(String id, boolean enabled) {
        return locks.withLock(id, () -> repository.findById(id).map(job -> {
            if (enabled) {
                if (job.getSchedule().getType() == ScheduleType.ONCE && job.getRunCount() > 0) {
                    throw new ConfigException("One-shot job '" + id + "' already ran and cannot be re-enabled");
                }
                job.setEnabled(true);
                job.setNextRunAt(job.getSchedule().firstRunAt(clock.instant()));
            } else {
                job.setEnabled(false);
                job.setNextRunAt(null);
            }
            Job saved = repository.save(job);
            log.info("Job {} {}, next run {}", id, enabled ? "enabled" : "disabled", saved.getNextRunAt());
            return saved;
        }));
    }

    /**
     * Mark a run as started. Returns empty when the job is gone, or, for a scheduled (not manual)
     * run, when it is no longer due, e.g. because the previous run advanced it in the meantime.
     */
    public Optional<Job> claim(String id, Instant now, boolean manual) {
        return locks.withLock(id, () -> {
            Optional<Job> found = repository.findById(id);
            if (found.isEmpty()) return Optional.<Job>empty();
            Job job = found.get();
            if (!manual && (!job.isEnabled() || job.getNextRunAt() == null || job.getNextRunAt().isAfter(now))) {
                return Optional.<Job>empty();
            }
            job.setRunStartedAt(now);
            return Optional.of(repository.save(job));
        });
    }

    /**
     * Record a finished run and compute the next fire time from {@code now}. A one-shot job is
     * disabled. Called exactly once per run, whatever the outcome.
     *
     * @return the updated job, empty if it was deleted while running
     */
    public Optional<Job> advance(String id, Instant now, Outcome outcome) {
        return locks.withLock(id, () -> {
            Optional<Job> found = repository.findById(id);
            if (found.isEmpty()) {
                log.info("Job {} was deleted during its run, nothing to advance", id);
                return Optional.<Job>empty();
            }
            Job job = found.get();
            job.setLastRunAt(now);
            job.setRunCount(job.getRunCount() + 1);
            job.setLastOutcome(outcome.status());
            job.setRunStartedAt(null);
            if (job.getSchedule().getType() == ScheduleType.ONCE) {
                job.setEnabled(false);
                job.setNextRunAt(null);
            } else if (!job.isEnabled()) {
                job.setNextRunAt(null);
            } else {
                job.setNextRunAt(job.getSchedule().nextRunAfter(now));
            }
            Job saved = repository.save(job);
            log.debug("Advanced job {} after {} run, next run {}", id, outcome.status(), saved.getNextRunAt());
            return Optional.of(saved);
        });
    }

    private void validate(Job job) {
        if (job.getName() == null || job.getName().isBlank()) {
            throw new ConfigException("Job name is required");
        }
        if (job.getSchedule() == null) {
            throw new ConfigException("Job schedule is required");
        }
        if (job.getAction() == null) {
            throw new ConfigException("Job action is required");
        }
        job.getSchedule().validate();
        job.getAction().validate(properties.getActions().getMaxCommandTimeoutSeconds());
    }
}
