package com.example.almanac.action;

public enum OutcomeStatus {
    SUCCESS,
    ERROR,
    /** Kept apart from ERROR so alert rules can tell hangs from failures. */
    TIMEOUT,
    /** The process died while the run was in flight; assigned during startup recovery. */
    INTERRUPTED
}
