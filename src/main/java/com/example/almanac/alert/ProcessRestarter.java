package com.example.almanac.alert;

/**
 * Restarts a monitored process.
 */
public interface ProcessRestarter {

    /**
     * @return short description of what was done
     * @throws com.example.almanac.common.AlmanacException if the restart failed
     */
    String restart(String processName);
}
