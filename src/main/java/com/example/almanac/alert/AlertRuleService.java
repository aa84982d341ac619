package com.example.almanac.alert;

import com.example.almanac.common.ConfigException;
import com.example.almanac.common.KeyedLocks;
import com.example.almanac.config.AlmanacProperties;
import com.example.almanac.domain.AlertHistoryEntry;
import com.example.almanac.domain.AlertRule;
import com.example.almanac.domain.AlertState;
import com.example.almanac.repository.AlertHistoryRepository;
import com.example.almanac.repository.AlertRuleRepository;
import com.example.almanac.repository.AlertStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Alert rule configuration and read access to alert state and history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertRuleService {

    private final AlertRuleRepository ruleRepository;
    private final AlertStateRepository stateRepository;
    private final AlertHistoryRepository historyRepository;
    private final AlmanacProperties properties;
    private final Clock clock;

    private final KeyedLocks locks = new KeyedLocks();

    public List<AlertRule> list() {
        return ruleRepository.findAllByOrderByCreatedAtAsc();
    }

    public Optional<AlertRule> get(String id) {
        return ruleRepository.findById(id);
    }

    /**
     * @throws ConfigException if the rule is invalid or its id is taken
     */
    public AlertRule create(AlertRule rule) {
        validate(rule);
        if (rule.getId() == null || rule.getId().isBlank()) {
            rule.setId(UUID.randomUUID().toString());
        } else if (ruleRepository.existsById(rule.getId())) {
            throw new ConfigException("Alert rule '" + rule.getId() + "' already exists");
        }
        rule.setCreatedAt(clock.instant());
        AlertRule saved = ruleRepository.save(rule);
        log.info("Created alert rule {} '{}' ({})", saved.getId(), saved.getName(), saved.getPredicate());
        return saved;
    }

    /**
     * Replace the definition of a rule. Its state (and breaker) is kept.
     */
    public Optional<AlertRule> update(String id, AlertRule changes) {
        return locks.withLock(id, () -> ruleRepository.findById(id).map(existing -> {
            changes.setId(id);
            changes.setCreatedAt(existing.getCreatedAt());
            validate(changes);
            AlertRule saved = ruleRepository.save(changes);
            log.info("Updated alert rule {}", id);
            return saved;
        }));
    }

    public Optional<AlertRule> setEnabled(String id, boolean enabled) {
        return locks.withLock(id, () -> ruleRepository.findById(id).map(rule -> {
            rule.setEnabled(enabled);
            log.info("Alert rule {} {}", id, enabled ? "enabled" : "disabled");
            return ruleRepository.save(rule);
        }));
    }

    /**
     * Insert the built-in rules whose ids are not taken yet. Existing rules, including ones the
     * user changed or disabled, are left alone.
     *
     * @return number of rules inserted
     */
    public int seedDefaults() {
        int inserted = 0;
        for (AlertRule rule : DefaultAlertRules.build(properties.getAlerts(), properties.getProcesses().keySet())) {
            if (ruleRepository.existsById(rule.getId())) continue;
            validate(rule);
            rule.setCreatedAt(clock.instant());
            ruleRepository.save(rule);
            inserted++;
        }
        if (inserted > 0) {
            log.info("Seeded {} built-in alert rule(s)", inserted);
        }
        return inserted;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getAlerts().isSeedDefaultRules()) {
            seedDefaults();
        }
    }

    @Transactional
    public boolean delete(String id) {
        if (!ruleRepository.existsById(id)) return false;
        ruleRepository.deleteById(id);
        stateRepository.deleteById(id);
        log.info("Deleted alert rule {}", id);
        return true;
    }

    /** State of a rule; a rule that was never evaluated reads as CLEAR. */
    public Optional<AlertState> state(String ruleId) {
        if (!ruleRepository.existsById(ruleId)) return Optional.empty();
        return Optional.of(stateRepository.findById(ruleId).orElseGet(() -> AlertState.clear(ruleId)));
    }

    public List<AlertState> states() {
        return stateRepository.findAll();
    }

    public List<AlertHistoryEntry> history(String ruleId, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        return ruleId != null
                ? historyRepository.findByRuleIdOrderByFiredAtDescIdDesc(ruleId, page)
                : historyRepository.findAllByOrderByFiredAtDescIdDesc(page);
    }

    private void validate(AlertRule rule) {
        if (rule.getName() == null || rule.getName().isBlank()) {
            throw new ConfigException("Alert rule name is required");
        }
        if (rule.getPredicate() == null) {
            throw new ConfigException("Alert rule predicate is required");
        }
        if (rule.getActionOnFire() == null) {
            rule.setActionOnFire(FireAction.NOTIFY);
        }
        if (rule.getWindowSeconds() <= 0 && !rule.getPredicate().isInstantaneous()) {
            throw new ConfigException("windowSeconds must be positive");
        }
        if (rule.getCooldownSeconds() < 0) {
            throw new ConfigException("cooldownSeconds must not be negative");
        }
        switch (rule.getPredicate()) {
            case METRIC_ABOVE -> {
                if (rule.getMetricField() == null || rule.getMetricField().isBlank()) {
                    throw new ConfigException("METRIC_ABOVE needs a metricField");
                }
            }
            case ENDPOINT_UNREACHABLE -> {
                if (rule.getEndpointUrl() == null || HttpUrl.parse(rule.getEndpointUrl()) == null) {
                    throw new ConfigException("ENDPOINT_UNREACHABLE needs a valid endpointUrl");
                }
            }
            case ERROR_RATE_ABOVE -> {
                if (rule.getThreshold() < 0) {
                    throw new ConfigException("threshold must not be negative");
                }
            }
            case SOURCE_SILENT -> {
                if (rule.getSource() == null || rule.getSource().isBlank()) {
                    throw new ConfigException("SOURCE_SILENT needs a source");
                }
            }
            case PROCESS_DOWN -> {
                if (rule.getPidFile() == null || rule.getPidFile().isBlank()) {
                    throw new ConfigException("PROCESS_DOWN needs a pidFile");
                }
            }
            case DISK_USAGE_ABOVE -> {
                if (rule.getPath() == null || rule.getPath().isBlank()) {
                    throw new ConfigException("DISK_USAGE_ABOVE needs a path");
                }
                if (rule.getThreshold() <= 0) {
                    throw new ConfigException("DISK_USAGE_ABOVE needs a positive threshold in MB");
                }
            }
        }
        if (rule.getActionOnFire() == FireAction.RESTART_AND_NOTIFY
                && (rule.getProcessName() == null || !properties.getProcesses().containsKey(rule.getProcessName()))) {
            throw new ConfigException("RESTART_AND_NOTIFY needs a configured processName, known processes: "
                    + properties.getProcesses().keySet());
        }
    }
}
