package com.example.almanac.alert;

import com.example.almanac.common.AlmanacException;

/**
 * A health probe could not run at all. Counts as a failed probe.
 */
public class ProbeException extends AlmanacException {

    public ProbeException(String message) {
        super(message);
    }

    public ProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
