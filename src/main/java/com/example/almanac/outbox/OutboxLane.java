package com.example.almanac.outbox;

/** FIFO delivery lane: all messages for one (channel, target). */
public record OutboxLane(String channel, String target) {

    @Override
    public String toString() {
        return channel + "|" + target;
    }
}
