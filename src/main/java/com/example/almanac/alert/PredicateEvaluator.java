package com.example.almanac.alert;

import com.example.almanac.config.AlmanacProperties;
import com.example.almanac.domain.AlertRule;
import com.example.almanac.domain.EventLogEntry;
import com.example.almanac.eventlog.EventLevel;
import com.example.almanac.eventlog.EventLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Evaluates the predicate of a rule at a point in time. Reads the event log, an endpoint or the
 * file system; never writes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PredicateEvaluator {

    /** How many recent events METRIC_ABOVE scans for one carrying the metric field. */
    private static final int METRIC_SCAN_LIMIT = 200;

    private final EventLogService eventLogService;
    private final OkHttpClient httpClient;
    private final AlmanacProperties properties;

    public Evaluation evaluate(AlertRule rule, Instant now) {
        Instant since = now.minusSeconds(rule.getWindowSeconds());
        return switch (rule.getPredicate()) {
            case ERROR_RATE_ABOVE -> errorRate(rule, since, now);
            case SOURCE_SILENT -> silence(rule, since, now);
            case METRIC_ABOVE -> metric(rule, since, now);
            case ENDPOINT_UNREACHABLE -> endpoint(rule);
            case PROCESS_DOWN -> processDown(rule);
            case DISK_USAGE_ABOVE -> diskUsage(rule);
        };
    }

    private Evaluation errorRate(AlertRule rule, Instant since, Instant now) {
        long errors = eventLogService.countAtOrAbove(EventLevel.ERROR, rule.getSource(), since, now);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("errors", errors);
        fields.put("threshold", rule.getThreshold());
        String message = String.format("%d error(s) from %s in the last %ds (threshold %s)",
                errors, sourceLabel(rule), rule.getWindowSeconds(), formatNumber(rule.getThreshold()));
        return errors > rule.getThreshold() ? Evaluation.triggered(message, fields) : Evaluation.ok(message, fields);
    }

    private Evaluation silence(AlertRule rule, Instant since, Instant now) {
        List<EventLogEntry> latest = eventLogService.latest(rule.getSource(), since, now, 1);
        if (latest.isEmpty()) {
            return Evaluation.triggered(String.format("No events from %s in the last %ds",
                    sourceLabel(rule), rule.getWindowSeconds()), Map.of("silent_seconds", rule.getWindowSeconds()));
        }
        Instant last = latest.get(0).getTimestamp();
        return Evaluation.ok("Last event from " + sourceLabel(rule) + " at " + last, Map.of("last_event_at", last.toString()));
    }

    private Evaluation metric(AlertRule rule, Instant since, Instant now) {
        String field = rule.getMetricField();
        for (EventLogEntry entry : eventLogService.latest(rule.getSource(), since, now, METRIC_SCAN_LIMIT)) {
            Double value = numeric(entry.getFields() != null ? entry.getFields().get(field) : null);
            if (value == null) continue;
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("metric", field);
            fields.put("value", value);
            fields.put("threshold", rule.getThreshold());
            fields.put("observed_at", entry.getTimestamp().toString());
            String message = String.format("%s is %s (threshold %s)", field, formatNumber(value), formatNumber(rule.getThreshold()));
            return value > rule.getThreshold() ? Evaluation.triggered(message, fields) : Evaluation.ok(message, fields);
        }
        return Evaluation.ok("No " + field + " datapoint from " + sourceLabel(rule) + " in window", null);
    }

    private Evaluation endpoint(AlertRule rule) {
        int timeout = properties.getAlerts().getEndpointTimeoutSeconds();
        OkHttpClient client = httpClient.newBuilder()
                .connectTimeout(timeout, TimeUnit.SECONDS)
                .readTimeout(timeout, TimeUnit.SECONDS)
                .callTimeout(timeout, TimeUnit.SECONDS)
                .build();
        Request request = new Request.Builder().url(rule.getEndpointUrl()).get().build();

        long start = System.currentTimeMillis();
        try (Response response = client.newCall(request).execute()) {
            long duration = System.currentTimeMillis() - start;
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("status_code", response.code());
            fields.put("duration_ms", duration);
            String message = String.format("%s answered HTTP %d (%dms)", rule.getEndpointUrl(), response.code(), duration);
            return response.isSuccessful() ? Evaluation.ok(message, fields) : Evaluation.triggered(message, fields);
        } catch (Exception e) {
            log.debug("Endpoint check of {} failed: {}", rule.getEndpointUrl(), e.getMessage());
            return Evaluation.triggered(rule.getEndpointUrl() + " unreachable: " + e.getMessage(),
                    Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private Evaluation processDown(AlertRule rule) {
        Path pidFile = expandHome(rule.getPidFile());
        String label = rule.getProcessName() != null ? rule.getProcessName() : rule.getName();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("pid_file", pidFile.toString());
        if (!Files.isRegularFile(pidFile)) {
            return Evaluation.triggered(String.format("PID file %s does not exist, %s is likely not running",
                    pidFile, label), fields);
        }

        long pid;
        try {
            pid = Long.parseLong(Files.readString(pidFile, StandardCharsets.UTF_8).strip());
        } catch (IOException | NumberFormatException e) {
            fields.put("error", String.valueOf(e.getMessage()));
            return Evaluation.triggered("Could not read a PID from " + pidFile, fields);
        }
        fields.put("pid", pid);
        boolean alive = ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
        return alive
                ? Evaluation.ok(String.format("%s is running (PID %d)", label, pid), fields)
                : Evaluation.triggered(String.format("%s process (PID %d) is not running", label, pid), fields);
    }

    private Evaluation diskUsage(AlertRule rule) {
        Path dir = expandHome(rule.getPath());
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("path", dir.toString());
        fields.put("limit_mb", rule.getThreshold());
        if (!Files.isDirectory(dir)) {
            return Evaluation.ok(dir + " does not exist", fields);
        }
        double megabytes = directorySize(dir) / (1024.0 * 1024.0);
        fields.put("size_mb", Math.round(megabytes * 10) / 10.0);
        String message = String.format("%s is %.0fMB (limit %sMB)", dir, megabytes, formatNumber(rule.getThreshold()));
        return megabytes > rule.getThreshold() ? Evaluation.triggered(message, fields) : Evaluation.ok(message, fields);
    }

    /** Total size of the regular files below {@code dir}; entries that cannot be read are skipped. */
    static long directorySize(Path dir) {
        AtomicLong total = new AtomicLong();
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        total.addAndGet(attrs.size());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.debug("Skipping {} while measuring {}: {}", file, dir, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Could not measure " + dir, e);
        }
        return total.get();
    }

    static Path expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home") + path.substring(1));
        }
        return Paths.get(path);
    }

    private static Double numeric(Object raw) {
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String sourceLabel(AlertRule rule) {
        return rule.getSource() == null || rule.getSource().isBlank() ? "any source" : rule.getSource();
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }
}
