package com.example.almanac.action;

import com.example.almanac.common.AlmanacException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A command or webhook failed. Carries the structured details recorded with the outcome.
 */
public class ActionExecutionException extends AlmanacException {

    private final Map<String, Object> fields;

    public ActionExecutionException(String message, Map<String, Object> fields) {
        super(message);
        this.fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }

    public ActionExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.fields = Map.of();
    }

    public Map<String, Object> getFields() {
        return fields;
    }
}
