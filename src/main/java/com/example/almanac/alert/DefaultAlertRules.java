package com.example.almanac.alert;

import com.example.almanac.config.AlmanacProperties;
import com.example.almanac.domain.AlertRule;

import java.util.List;
import java.util.Set;

/**
 * Rules every installation starts with: error spikes per service, the Manor API health check,
 * the data directory size, and Herald's PID file.
 */
final class DefaultAlertRules {

    static final String HERALD = "herald";

    private DefaultAlertRules() {
    }

    static List<AlertRule> build(AlmanacProperties.AlertConfig alerts, Set<String> knownProcesses) {
        String dataDir = trimTrailingSlash(alerts.getDataDir());
        // auto-restart only when there is a restart command for herald
        FireAction onHeraldDown = knownProcesses.contains(HERALD) ? FireAction.RESTART_AND_NOTIFY : FireAction.NOTIFY;

        return List.of(
                errorSpike("error_spike_herald", "Herald Error Spike", "herald", 5),
                errorSpike("error_spike_manor", "Manor Error Spike", "manor", 5),
                errorSpike("error_spike_almanac", "Almanac Error Spike", "almanac", 3),
                AlertRule.builder()
                        .id("service_down_manor")
                        .name("Manor API Down")
                        .description("Alert when the Manor API health endpoint is unreachable")
                        .predicate(AlertPredicate.ENDPOINT_UNREACHABLE)
                        .endpointUrl(alerts.getManorHealthUrl())
                        .cooldownSeconds(300)
                        .build(),
                AlertRule.builder()
                        .id("disk_space_low")
                        .name("Low Disk Space")
                        .description("Alert when " + dataDir + " grows past " + (long) alerts.getDiskLimitMb() + "MB")
                        .predicate(AlertPredicate.DISK_USAGE_ABOVE)
                        .path(dataDir)
                        .threshold(alerts.getDiskLimitMb())
                        .cooldownSeconds(3600)
                        .build(),
                AlertRule.builder()
                        .id("process_herald")
                        .name("Herald Process Down")
                        .description("Alert when the Herald process is not running (via PID file)")
                        .predicate(AlertPredicate.PROCESS_DOWN)
                        .pidFile(dataDir + "/herald.pid")
                        .actionOnFire(onHeraldDown)
                        .processName(onHeraldDown == FireAction.RESTART_AND_NOTIFY ? HERALD : null)
                        .cooldownSeconds(300)
                        .build()
        );
    }

    private static AlertRule errorSpike(String id, String name, String source, double threshold) {
        return AlertRule.builder()
                .id(id)
                .name(name)
                .description(String.format("Alert when %s logs more than %d errors in 15 minutes", source, (long) threshold))
                .predicate(AlertPredicate.ERROR_RATE_ABOVE)
                .source(source)
                .threshold(threshold)
                .windowSeconds(900)
                .cooldownSeconds(1800)
                .build();
    }

    private static String trimTrailingSlash(String dir) {
        return dir.endsWith("/") && dir.length() > 1 ? dir.substring(0, dir.length() - 1) : dir;
    }
}
