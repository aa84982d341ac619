package com.example.almanac.alert;

/**
 * What an alert rule looks for.
 */
public enum AlertPredicate {
    /** More than {@code threshold} ERROR-or-worse events from the rule's source within the window. */
    ERROR_RATE_ABOVE,
    /** No event at all from the rule's source within the window. */
    SOURCE_SILENT,
    /** Latest value of the rule's metric field within the window is above {@code threshold}. */
    METRIC_ABOVE,
    /** HTTP GET of the rule's endpoint fails or answers non-2xx. */
    ENDPOINT_UNREACHABLE,
    /** The process named in the rule's PID file is not alive, or the file is missing or unreadable. */
    PROCESS_DOWN,
    /** Files under the rule's directory add up to more than {@code threshold} megabytes. */
    DISK_USAGE_ABOVE;

    /** Predicates that look at the present state only, so the window does not apply. */
    public boolean isInstantaneous() {
        return this == ENDPOINT_UNREACHABLE || this == PROCESS_DOWN || this == DISK_USAGE_ABOVE;
    }
}
