package com.example.almanac.outbox;

public enum OutboxStatus {
    PENDING, SENT, FAILED
}
