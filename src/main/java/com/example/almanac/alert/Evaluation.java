package com.example.almanac.alert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of evaluating a rule's predicate once.
 *
 * @param message human-readable reading, e.g. "7 errors from herald in 300s (threshold 5)"
 */
public record Evaluation(boolean triggered, String message, Map<String, Object> fields) {

    public Evaluation {
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }

    public static Evaluation triggered(String message, Map<String, Object> fields) {
        return new Evaluation(true, message, fields);
    }

    public static Evaluation ok(String message, Map<String, Object> fields) {
        return new Evaluation(false, message, fields);
    }
}
