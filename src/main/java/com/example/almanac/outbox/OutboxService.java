package com.example.almanac.outbox;

import com.example.almanac.common.ConfigException;
import com.example.almanac.common.StripedLocks;
import com.example.almanac.config.AlmanacProperties;
import com.example.almanac.domain.OutboxMessage;
import com.example.almanac.repository.OutboxRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable notification queue. Enqueue is a local write; delivery happens later in
 * {@link OutboxDispatcher}. State transitions of one message are serialized by message id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxService {

    private final OutboxRepository repository;
    private final AlmanacProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final StripedLocks locks = new StripedLocks(64);

    /**
     * Queue a message. A repeated {@code dedupKey} returns the id of the message already queued.
     *
     * @return id of the queued message
     * @throws ConfigException if channel, target or body is missing
     */
    public long enqueue(String channel, String target, String body, String sender, String dedupKey) {
        if (isBlank(channel) || isBlank(target)) {
            throw new ConfigException("Outbox message needs a channel and a target");
        }
        if (body == null || body.isEmpty()) {
            throw new ConfigException("Outbox message body is empty");
        }
        String key = isBlank(dedupKey) ? null : dedupKey;
        if (key != null) {
            Optional<OutboxMessage> existing = repository.findByDedupKey(key);
            if (existing.isPresent()) {
                log.debug("Outbox dedup hit for key {} (message {})", key, existing.get().getId());
                return existing.get().getId();
            }
        }

        Instant now = clock.instant();
        OutboxMessage message = OutboxMessage.builder()
                .channel(channel)
                .target(target)
                .body(body)
                .sender(sender)
                .dedupKey(key)
                .status(OutboxStatus.PENDING)
                .createdAt(now)
                .nextAttemptAt(now)
                .build();
        try {
            OutboxMessage saved = repository.saveAndFlush(message);
            log.info("Queued outbox message {} for {}:{} from {}", saved.getId(), channel, target, sender);
            return saved.getId();
        } catch (DataIntegrityViolationException e) {
            // lost a race with another enqueue of the same key
            if (key != null) {
                Optional<OutboxMessage> existing = repository.findByDedupKey(key);
                if (existing.isPresent()) {
                    return existing.get().getId();
                }
            }
            throw e;
        }
    }

    public long enqueue(String channel, String target, String body, String sender) {
        return enqueue(channel, target, body, sender, null);
    }

    /** Oldest pending messages across all lanes, due or not. */
    public List<OutboxMessage> pending() {
        return repository.findByStatusOrderByIdAsc(OutboxStatus.PENDING,
                PageRequest.of(0, properties.getOutbox().getBatchSize()));
    }

    /**
     * Work for one dispatch pass: each lane whose head is due, with up to {@code batchSize} of its
     * pending messages in id order. Selection is per lane, so a backed-up target cannot crowd the
     * others out of the pass.
     */
    public Map<OutboxLane, List<OutboxMessage>> dueLanes(Instant now) {
        int batchSize = properties.getOutbox().getBatchSize();
        List<OutboxLane> lanes = repository.findLanesWithDueHead(OutboxStatus.PENDING, now,
                PageRequest.of(0, properties.getOutbox().getMaxLanesPerPass()));
        Map<OutboxLane, List<OutboxMessage>> work = new LinkedHashMap<>();
        for (OutboxLane lane : lanes) {
            work.put(lane, repository.findByChannelAndTargetAndStatusOrderByIdAsc(lane.channel(), lane.target(),
                    OutboxStatus.PENDING, PageRequest.of(0, batchSize)));
        }
        return work;
    }

    /** Newest first, optionally filtered by status. */
    public List<OutboxMessage> list(OutboxStatus status, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        return status != null
                ? repository.findByStatusOrderByIdDesc(status, page)
                : repository.findAllByOrderByIdDesc(page);
    }

    public Optional<OutboxMessage> get(long id) {
        return repository.findById(id);
    }

    public long countByStatus(OutboxStatus status) {
        return repository.countByStatus(status);
    }

    /**
     * Record a successful delivery. {@code sentAt} is only set on the transition into SENT.
     */
    public void markSent(long id, Instant now) {
        locks.withLock(id, () -> repository.findById(id).ifPresent(message -> {
            if (message.getStatus() != OutboxStatus.PENDING) {
                log.warn("Ignoring delivery report for outbox message {} in status {}", id, message.getStatus());
                return;
            }
            message.setAttempts(message.getAttempts() + 1);
            message.setStatus(OutboxStatus.SENT);
            message.setSentAt(now);
            message.setLastError(null);
            message.setNextAttemptAt(null);
            repository.save(message);
            meterRegistry.counter("almanac.outbox.deliveries", "channel", message.getChannel(), "result", "sent").increment();
            log.info("Delivered outbox message {} to {}:{} (attempt {})",
                    id, message.getChannel(), message.getTarget(), message.getAttempts());
        }));
    }

    /**
     * Record a failed attempt: back off and stay PENDING, or go FAILED when the error is permanent
     * or the attempts are used up.
     */
    public void markFailedAttempt(long id, String error, boolean permanent, Instant now) {
        locks.withLock(id, () -> repository.findById(id).ifPresent(message -> {
            if (message.getStatus() != OutboxStatus.PENDING) {
                log.warn("Ignoring failure report for outbox message {} in status {}", id, message.getStatus());
                return;
            }
            int attempts = message.getAttempts() + 1;
            int maxAttempts = properties.getOutbox().getMaxAttempts();
            message.setAttempts(attempts);
            message.setLastError(truncate(error));
            if (permanent || attempts >= maxAttempts) {
                message.setStatus(OutboxStatus.FAILED);
                message.setNextAttemptAt(null);
                meterRegistry.counter("almanac.outbox.deliveries", "channel", message.getChannel(), "result", "failed").increment();
                log.error("Outbox message {} to {}:{} failed after {} attempt(s){}: {}", id,
                        message.getChannel(), message.getTarget(), attempts, permanent ? " (permanent)" : "", error);
            } else {
                Duration delay = backoff(attempts);
                message.setNextAttemptAt(now.plus(delay));
                meterRegistry.counter("almanac.outbox.deliveries", "channel", message.getChannel(), "result", "retry").increment();
                log.warn("Outbox message {} attempt {}/{} failed, retrying in {}s: {}",
                        id, attempts, maxAttempts, delay.toSeconds(), error);
            }
            repository.save(message);
        }));
    }

    /**
     * Report the outcome of a delivery made outside this process.
     *
     * @return the updated message, empty if it does not exist
     */
    public Optional<OutboxMessage> recordOutcome(long id, DeliveryOutcome outcome) {
        Instant now = clock.instant();
        if (outcome.delivered()) {
            markSent(id, now);
        } else {
            markFailedAttempt(id, outcome.error() != null ? outcome.error() : "delivery failed", outcome.permanent(), now);
        }
        return repository.findById(id);
    }

    /**
     * Put a FAILED message back in the queue with a fresh attempt budget.
     *
     * @return the requeued message, empty if it does not exist
     * @throws IllegalStateException if the message is not FAILED
     */
    public Optional<OutboxMessage> retry(long id) {
        return locks.withLock(id, () -> repository.findById(id).map(message -> {
            if (message.getStatus() != OutboxStatus.FAILED) {
                throw new IllegalStateException("Only FAILED messages can be retried, message " + id + " is " + message.getStatus());
            }
            message.setStatus(OutboxStatus.PENDING);
            message.setAttempts(0);
            message.setNextAttemptAt(clock.instant());
            log.info("Requeued outbox message {} (last error: {})", id, message.getLastError());
            return repository.save(message);
        }));
    }

    /** {@code min(maxBackoff, baseBackoff * 2^(attempts-1))}. */
    Duration backoff(int attempts) {
        long base = properties.getOutbox().getBaseBackoffSeconds();
        long max = properties.getOutbox().getMaxBackoffSeconds();
        int shift = Math.min(Math.max(attempts - 1, 0), 30);
        long seconds = base * (1L << shift);
        return Duration.ofSeconds(Math.min(max, seconds));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String truncate(String value) {
        if (value == null) return null;
        return value.length() <= 2000 ? value : value.substring(0, 2000) + "...";
    }
}
