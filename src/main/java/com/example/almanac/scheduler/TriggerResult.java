package com.example.almanac.scheduler;

public enum TriggerResult {
    STARTED, ALREADY_RUNNING, NOT_FOUND
}
