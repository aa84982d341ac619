package com.example.almanac.action;

import java.time.Instant;

/**
 * Which job run an action belongs to.
 *
 * @param runNumber 1-based number of this run (previous run count + 1)
 */
public record ActionContext(String jobId, String jobName, long runNumber, Instant firedAt, boolean manual) {
}
