package com.example.almanac.action;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one action execution.
 *
 * @param fields structured details (exit code, status code, captured output) for the event log
 */
public record Outcome(OutcomeStatus status, String detail, Duration duration, Map<String, Object> fields) {

    public Outcome {
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
        duration = duration != null ? duration : Duration.ZERO;
    }

    public static Outcome success(String detail, Map<String, Object> fields) {
        return new Outcome(OutcomeStatus.SUCCESS, detail, Duration.ZERO, fields);
    }

    public static Outcome error(String detail, Map<String, Object> fields) {
        return new Outcome(OutcomeStatus.ERROR, detail, Duration.ZERO, fields);
    }

    public static Outcome timeout(String detail, Map<String, Object> fields) {
        return new Outcome(OutcomeStatus.TIMEOUT, detail, Duration.ZERO, fields);
    }

    public static Outcome interrupted(String detail) {
        return new Outcome(OutcomeStatus.INTERRUPTED, detail, Duration.ZERO, null);
    }

    public Outcome withDuration(Duration elapsed) {
        return new Outcome(status, detail, elapsed, fields);
    }

    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCESS;
    }

    /** Fields plus status and duration, as written to the event log. */
    public Map<String, Object> toEventFields() {
        Map<String, Object> merged = new LinkedHashMap<>(fields);
        merged.put("outcome", status.name().toLowerCase());
        merged.put("duration_ms", duration.toMillis());
        return merged;
    }
}
