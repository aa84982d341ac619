package com.example.almanac;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Almanac - automation backbone of the homestead platform.
 *
 * Four loops share one process:
 * - Scheduler → fires cron / interval / one-shot jobs through the action executor
 * - Alert Engine → evaluates rules against the event log, restarts the dependent process
 * - Outbox dispatcher → delivers queued notifications to channel adapters
 * - Event log → append-only structured log every component writes to
 */
@SpringBootApplication
@EnableScheduling
public class AlmanacApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlmanacApplication.class, args);
    }
}
