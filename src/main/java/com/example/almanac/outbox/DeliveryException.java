package com.example.almanac.outbox;

import com.example.almanac.common.AlmanacException;

/**
 * A channel adapter could not deliver a message. Retryable unless {@link #isPermanent()}.
 */
public class DeliveryException extends AlmanacException {

    private final boolean permanent;

    public DeliveryException(String message, boolean permanent) {
        super(message);
        this.permanent = permanent;
    }

    public DeliveryException(String message, boolean permanent, Throwable cause) {
        super(message, cause);
        this.permanent = permanent;
    }

    public static DeliveryException retryable(String message) {
        return new DeliveryException(message, false);
    }

    public static DeliveryException permanent(String message) {
        return new DeliveryException(message, true);
    }

    public boolean isPermanent() {
        return permanent;
    }
}
