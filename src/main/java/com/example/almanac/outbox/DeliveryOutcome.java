package com.example.almanac.outbox;

/**
 * Result of one delivery attempt, as reported by an adapter.
 *
 * @param permanent only meaningful when not delivered; skips the remaining retries
 */
public record DeliveryOutcome(boolean delivered, String error, boolean permanent) {

    public static DeliveryOutcome sent() {
        return new DeliveryOutcome(true, null, false);
    }

    public static DeliveryOutcome retryableFailure(String error) {
        return new DeliveryOutcome(false, error, false);
    }

    public static DeliveryOutcome permanentFailure(String error) {
        return new DeliveryOutcome(false, error, true);
    }
}
