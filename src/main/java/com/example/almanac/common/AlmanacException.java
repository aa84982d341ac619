package com.example.almanac.common;

/**
 * Base of all errors raised by Almanac components.
 */
public class AlmanacException extends RuntimeException {

    public AlmanacException(String message) {
        super(message);
    }

    public AlmanacException(String message, Throwable cause) {
        super(message, cause);
    }
}
