package com.example.almanac.alert;

/**
 * Result of a safety-checked restart attempt.
 */
public record RestartOutcome(Status status, String detail) {

    public enum Status {
        /** Probe passed and the restart command succeeded. */
        RESTARTED,
        /** Probe failed, nothing was restarted. */
        DECLINED,
        /** Probe passed but the restart itself failed, or the process is unknown. */
        FAILED,
        /** Another restart of the same process is running; this attempt was skipped. */
        IN_PROGRESS
    }

    public static RestartOutcome of(Status status, String detail) {
        return new RestartOutcome(status, detail);
    }
}
