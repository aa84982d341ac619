package com.example.almanac.outbox;

/**
 * Delivers a message body to one target on one channel (a chat id, a webhook).
 * Implementations are Spring beans; the dispatcher picks them by {@link #channel()}.
 */
public interface ChannelAdapter {

    /** Channel name as stored on outbox messages, e.g. "telegram". */
    String channel();

    /**
     * Deliver synchronously.
     *
     * @throws DeliveryException on failure; any other exception is treated as retryable
     */
    void deliver(String target, String body);
}
