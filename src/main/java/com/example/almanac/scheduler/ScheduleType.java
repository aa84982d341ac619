package com.example.almanac.scheduler;

public enum ScheduleType {
    CRON, INTERVAL, ONCE
}
