package com.example.almanac.eventlog;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public enum EventLevel {
    DEBUG, INFO, WARNING, ERROR, CRITICAL;

    /** This level and every more severe one. */
    public List<EventLevel> andAbove() {
        return Arrays.stream(values()).filter(l -> l.ordinal() >= ordinal()).toList();
    }

    /** Lenient parse that also accepts the common "WARN" spelling. */
    public static EventLevel parse(String raw) {
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if ("WARN".equals(normalized)) return WARNING;
        return valueOf(normalized);
    }
}
