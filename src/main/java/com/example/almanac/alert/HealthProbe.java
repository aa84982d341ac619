package com.example.almanac.alert;

/**
 * Checks that a process could start before it is restarted, e.g. that its code still imports.
 */
public interface HealthProbe {

    /**
     * @throws ProbeException if the probe itself cannot be run
     */
    ProbeResult probe(String processName);
}
