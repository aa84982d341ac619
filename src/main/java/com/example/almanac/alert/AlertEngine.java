package com.example.almanac.alert;

import com.example.almanac.common.KeyedLocks;
import com.example.almanac.config.AlmanacProperties;
import com.example.almanac.domain.AlertHistoryEntry;
import com.example.almanac.domain.AlertRule;
import com.example.almanac.domain.AlertState;
import com.example.almanac.eventlog.EventLevel;
import com.example.almanac.eventlog.EventLogService;
import com.example.almanac.outbox.OutboxService;
import com.example.almanac.repository.AlertHistoryRepository;
import com.example.almanac.repository.AlertRuleRepository;
import com.example.almanac.repository.AlertStateRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates alert rules against the event log and drives each rule through
 * {@code CLEAR -> FIRING -> CLEAR}.
 *
 * <p>Per tick and rule: the predicate is evaluated (and, on a fresh fire, the restart attempted)
 * outside any transaction; the resulting state, history and outbox writes then commit together.
 * Evaluations of the same rule are serialized by rule id.</p>
 *
 * <p>Circuit breaker: once a rule has fired {@code breakerCeiling} ticks in a row it is suppressed.
 * Its state keeps updating but it produces no outbox messages until it clears.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertEngine {

    public static final String EVENT_SOURCE = "almanac.alerts";

    private final AlertRuleRepository ruleRepository;
    private final AlertStateRepository stateRepository;
    private final AlertHistoryRepository historyRepository;
    private final PredicateEvaluator evaluator;
    private final RestartCoordinator restartCoordinator;
    private final OutboxService outboxService;
    private final EventLogService eventLogService;
    private final AlmanacProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final KeyedLocks locks = new KeyedLocks();

    /** Notification kinds. Restart and resolve notices are not subject to cooldown. */
    enum NoticeKind {
        FIRING, REMINDER, RESTARTED, RESTART_DECLINED, RESTART_FAILED, RESOLVED;

        boolean bypassesCooldown() {
            return this != FIRING && this != REMINDER;
        }

        String slug() {
            return name().toLowerCase().replace('_', '-');
        }
    }

    record Notice(NoticeKind kind, String body) {}

    @Scheduled(fixedDelayString = "${almanac.alerts.tick-millis:30000}", initialDelay = 10000)
    public void tick() {
        if (!properties.getAlerts().isEnabled()) return;
        try {
            evaluateAll(clock.instant());
        } catch (Exception e) {
            log.error("Alert tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Evaluate all enabled rules. A failing rule is logged and skipped.
     *
     * @return number of status transitions
     */
    public int evaluateAll(Instant now) {
        List<AlertRule> rules = ruleRepository.findByEnabledTrueOrderByIdAsc();
        int transitions = 0;
        for (AlertRule rule : rules) {
            try {
                if (evaluate(rule, now)) {
                    transitions++;
                }
            } catch (Exception e) {
                log.error("Error evaluating alert rule {}: {}", rule.getId(), e.getMessage(), e);
            }
        }
        return transitions;
    }

    /**
     * Evaluate one rule.
     *
     * @return true if the rule changed status
     */
    public boolean evaluate(AlertRule rule, Instant now) {
        return locks.withLock(rule.getId(), () -> {
            Evaluation evaluation = evaluator.evaluate(rule, now);
            AlertState state = stateRepository.findById(rule.getId())
                    .orElseGet(() -> AlertState.clear(rule.getId()));

            if (evaluation.triggered()) {
                if (state.getStatus() == AlertStatus.CLEAR) {
                    onFire(rule, state, evaluation, now);
                    return true;
                }
                onRefire(rule, state, evaluation, now);
                return false;
            }
            if (state.getStatus() == AlertStatus.FIRING) {
                onClear(rule, state, evaluation, now);
                return true;
            }
            state.setLastEvaluatedAt(now);
            state.setLastMessage(evaluation.message());
            stateRepository.save(state);
            return false;
        });
    }

    private void onFire(AlertRule rule, AlertState state, Evaluation evaluation, Instant now) {
        RestartOutcome restart = null;
        if (rule.getActionOnFire() == FireAction.RESTART_AND_NOTIFY) {
            restart = restartCoordinator.attempt(rule.getProcessName());
        }
        Notice notice = fireNotice(rule, evaluation, restart);
        int ceiling = properties.getAlerts().getBreakerCeiling();

        transactionTemplate.executeWithoutResult(tx -> {
            state.setStatus(AlertStatus.FIRING);
            state.setFiredAt(now);
            state.setConsecutiveFires(1);
            state.setSuppressed(1 >= ceiling);
            state.setClearedAt(null);
            state.setLastEvaluatedAt(now);
            state.setLastMessage(evaluation.message());

            AlertHistoryEntry history = AlertHistoryEntry.builder()
                    .ruleId(rule.getId())
                    .ruleName(rule.getName())
                    .firedAt(now)
                    .message(evaluation.message())
                    .fireCount(1)
                    .build();
            if (maybeNotify(rule, state, notice, now)) {
                history.setNotificationsSent(1);
            }
            stateRepository.save(state);
            historyRepository.save(history);
        });

        Map<String, Object> fields = eventFields(rule, state, evaluation);
        if (restart != null) {
            fields.put("restart", restart.status().name().toLowerCase());
        }
        eventLogService.append(EventLevel.WARNING, EVENT_SOURCE,
                "Alert '" + rule.getName() + "' firing: " + evaluation.message(), fields);
        meterRegistry.counter("almanac.alerts.transitions", "rule", rule.getId(), "to", "firing").increment();
        log.warn("Alert triggered: {} - {}", rule.getName(), evaluation.message());
    }

    private void onRefire(AlertRule rule, AlertState state, Evaluation evaluation, Instant now) {
        int ceiling = properties.getAlerts().getBreakerCeiling();
        boolean tripped = transactionTemplate.execute(tx -> {
            state.setConsecutiveFires(state.getConsecutiveFires() + 1);
            state.setLastEvaluatedAt(now);
            state.setLastMessage(evaluation.message());
            boolean justTripped = false;
            if (!state.isSuppressed() && state.getConsecutiveFires() >= ceiling) {
                state.setSuppressed(true);
                justTripped = true;
            }

            AlertHistoryEntry history = historyRepository.findFirstByRuleIdAndResolvedFalseOrderByIdDesc(rule.getId())
                    .orElse(null);
            Notice reminder = new Notice(NoticeKind.REMINDER, reminderBody(rule, state, evaluation));
            boolean sent = maybeNotify(rule, state, reminder, now);
            if (history != null) {
                history.setFireCount(state.getConsecutiveFires());
                if (sent) {
                    history.setNotificationsSent(history.getNotificationsSent() + 1);
                }
                historyRepository.save(history);
            }
            stateRepository.save(state);
            return justTripped;
        });

        if (Boolean.TRUE.equals(tripped)) {
            log.warn("Rule {} circuit breaker open after {} consecutive fires, recording only",
                    rule.getId(), state.getConsecutiveFires());
            eventLogService.append(EventLevel.WARNING, EVENT_SOURCE,
                    "Alert '" + rule.getName() + "' suppressed after " + state.getConsecutiveFires() + " consecutive fires",
                    eventFields(rule, state, evaluation));
        } else {
            log.debug("Rule {} still firing ({} consecutive)", rule.getId(), state.getConsecutiveFires());
        }
    }

    private void onClear(AlertRule rule, AlertState state, Evaluation evaluation, Instant now) {
        Instant firedAt = state.getFiredAt();
        int fires = state.getConsecutiveFires();

        transactionTemplate.executeWithoutResult(tx -> {
            AlertHistoryEntry history = historyRepository.findFirstByRuleIdAndResolvedFalseOrderByIdDesc(rule.getId())
                    .orElse(null);
            String original = history != null && history.getMessage() != null ? history.getMessage() : state.getLastMessage();

            state.setStatus(AlertStatus.CLEAR);
            state.setConsecutiveFires(0);
            state.setSuppressed(false);
            state.setClearedAt(now);
            state.setLastEvaluatedAt(now);
            state.setLastMessage(evaluation.message());

            Notice resolved = new Notice(NoticeKind.RESOLVED, String.format(
                    "<b>Resolved: %s</b>\n\nFired at %s\nPreviously: %s\nResolved after %d alert(s).",
                    rule.getName(), firedAt, original, fires));
            boolean sent = maybeNotify(rule, state, resolved, now);
            if (history != null) {
                history.setResolved(true);
                history.setResolvedAt(now);
                if (sent) {
                    history.setNotificationsSent(history.getNotificationsSent() + 1);
                }
                historyRepository.save(history);
            }
            stateRepository.save(state);
        });

        eventLogService.append(EventLevel.INFO, EVENT_SOURCE,
                "Alert '" + rule.getName() + "' resolved: " + evaluation.message(), eventFields(rule, state, evaluation));
        meterRegistry.counter("almanac.alerts.transitions", "rule", rule.getId(), "to", "clear").increment();
        log.info("Alert resolved: {} (fired at {}, {} consecutive fires)", rule.getName(), firedAt, fires);
    }

    /**
     * Enqueue a notice unless the rule is suppressed or, for firing notices, still in cooldown.
     *
     * @return true if a message was queued
     */
    private boolean maybeNotify(AlertRule rule, AlertState state, Notice notice, Instant now) {
        if (state.isSuppressed()) {
            return false;
        }
        if (!notice.kind().bypassesCooldown() && inCooldown(rule, state, now)) {
            log.debug("Alert rule {} in cooldown period", rule.getId());
            return false;
        }
        String channel = notEmpty(rule.getNotifyChannel(), properties.getAlerts().getDefaultChannel());
        String target = notEmpty(rule.getNotifyTarget(), properties.getAlerts().getDefaultTarget());
        if (target == null || target.isBlank()) {
            log.warn("Alert rule {} has no notification target and no default is configured", rule.getId());
            return false;
        }
        String dedupKey = String.format("alert:%s:%s:%d:%d", rule.getId(), notice.kind().slug(),
                state.getFiredAt() != null ? state.getFiredAt().toEpochMilli() : 0L, state.getConsecutiveFires());
        outboxService.enqueue(channel, target, notice.body(), properties.getAlerts().getSender(), dedupKey);
        if (notice.kind() != NoticeKind.RESOLVED) {
            state.setLastNotifiedAt(now);
        }
        return true;
    }

    private static boolean inCooldown(AlertRule rule, AlertState state, Instant now) {
        return state.getLastNotifiedAt() != null
                && now.isBefore(state.getLastNotifiedAt().plusSeconds(rule.getCooldownSeconds()));
    }

    private Notice fireNotice(AlertRule rule, Evaluation evaluation, RestartOutcome restart) {
        String header = "<b>Alert: " + rule.getName() + "</b>\n\n" + evaluation.message();
        if (restart == null) {
            return new Notice(NoticeKind.FIRING, header);
        }
        String process = rule.getProcessName();
        return switch (restart.status()) {
            case RESTARTED -> new Notice(NoticeKind.RESTARTED,
                    header + "\n\nRestarted " + process + " (health probe passed).");
            case DECLINED -> new Notice(NoticeKind.RESTART_DECLINED,
                    header + "\n\nNot restarting " + process + ": health probe failed.\n" + restart.detail());
            case FAILED -> new Notice(NoticeKind.RESTART_FAILED,
                    header + "\n\nRestart of " + process + " failed: " + restart.detail());
            case IN_PROGRESS -> new Notice(NoticeKind.FIRING,
                    header + "\n\nA restart of " + process + " is already in progress.");
        };
    }

    private static String reminderBody(AlertRule rule, AlertState state, Evaluation evaluation) {
        return String.format("<b>Still firing: %s</b>\n\n%s\nFiring since %s (%d consecutive checks).",
                rule.getName(), evaluation.message(), state.getFiredAt(), state.getConsecutiveFires());
    }

    private static Map<String, Object> eventFields(AlertRule rule, AlertState state, Evaluation evaluation) {
        Map<String, Object> fields = new LinkedHashMap<>(evaluation.fields());
        fields.put("rule_id", rule.getId());
        fields.put("predicate", rule.getPredicate().name());
        fields.put("status", state.getStatus().name());
        fields.put("consecutive_fires", state.getConsecutiveFires());
        fields.put("suppressed", state.isSuppressed());
        return fields;
    }

    private static String notEmpty(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
