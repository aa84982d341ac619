package com.example.almanac.common;

/**
 * Invalid job or alert configuration (malformed cron, unknown action type, missing field).
 * Raised when the configuration is written, never from inside a loop.
 */
public class ConfigException extends AlmanacException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
