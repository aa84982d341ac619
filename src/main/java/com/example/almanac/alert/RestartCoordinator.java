package com.example.almanac.alert;

import com.example.almanac.common.KeyedLocks;
import com.example.almanac.config.AlmanacProperties;
import com.example.almanac.eventlog.EventLevel;
import com.example.almanac.eventlog.EventLogService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Safety-checked restart: probe first, restart only when the probe passes. One attempt per
 * process at a time; a concurrent attempt for the same process is skipped, not queued.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RestartCoordinator {

    private final HealthProbe healthProbe;
    private final ProcessRestarter processRestarter;
    private final EventLogService eventLogService;
    private final AlmanacProperties properties;
    private final MeterRegistry meterRegistry;

    private final KeyedLocks locks = new KeyedLocks();

    public RestartOutcome attempt(String processName) {
        AtomicReference<RestartOutcome> result = new AtomicReference<>();
        boolean ran = locks.tryWithLock(processName, () -> result.set(probeAndRestart(processName)));
        if (!ran) {
            log.info("Restart of {} already in progress, skipping", processName);
            return RestartOutcome.of(RestartOutcome.Status.IN_PROGRESS, "restart already in progress");
        }
        RestartOutcome outcome = result.get();
        meterRegistry.counter("almanac.restarts", "process", processName,
                "result", outcome.status().name().toLowerCase()).increment();
        return outcome;
    }

    private RestartOutcome probeAndRestart(String processName) {
        if (processName == null || !properties.getProcesses().containsKey(processName)) {
            log.error("Cannot restart unknown process '{}'", processName);
            return RestartOutcome.of(RestartOutcome.Status.FAILED, "unknown process '" + processName + "'");
        }

        ProbeResult probe;
        try {
            probe = healthProbe.probe(processName);
        } catch (Exception e) {
            probe = ProbeResult.failed("probe error: " + e.getMessage());
        }
        if (!probe.ok()) {
            log.warn("Not restarting {}: {}", processName, probe.detail());
            eventLogService.append(EventLevel.WARNING, AlertEngine.EVENT_SOURCE,
                    "Restart of " + processName + " declined: " + probe.detail(),
                    Map.of("process", processName, "restart", "declined"));
            return RestartOutcome.of(RestartOutcome.Status.DECLINED, probe.detail());
        }

        try {
            String detail = processRestarter.restart(processName);
            log.info("Restarted {}: {}", processName, detail);
            eventLogService.append(EventLevel.INFO, AlertEngine.EVENT_SOURCE,
                    "Restarted " + processName, Map.of("process", processName, "restart", "restarted"));
            return RestartOutcome.of(RestartOutcome.Status.RESTARTED, detail);
        } catch (Exception e) {
            log.error("Restart of {} failed: {}", processName, e.getMessage());
            eventLogService.append(EventLevel.WARNING, AlertEngine.EVENT_SOURCE,
                    "Restart of " + processName + " failed: " + e.getMessage(),
                    Map.of("process", processName, "restart", "failed"));
            return RestartOutcome.of(RestartOutcome.Status.FAILED, e.getMessage());
        }
    }
}
