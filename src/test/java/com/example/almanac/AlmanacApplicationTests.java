package com.example.almanac;

import com.example.almanac.action.JobAction;
import com.example.almanac.action.OutcomeStatus;
import com.example.almanac.config.AlmanacProperties;
import com.example.almanac.domain.Job;
import com.example.almanac.domain.OutboxMessage;
import com.example.almanac.repository.JobRepository;
import com.example.almanac.repository.OutboxRepository;
import com.example.almanac.scheduler.JobSchedule;
import com.example.almanac.scheduler.JobScheduler;
import com.example.almanac.scheduler.JobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class AlmanacApplicationTests {

    @Autowired
    private AlmanacProperties properties;
    @Autowired
    private JobStore jobStore;
    @Autowired
    private JobScheduler jobScheduler;
    @Autowired
    private JobRepository jobRepository;
    @Autowired
    private OutboxRepository outboxRepository;

    @BeforeEach
    void cleanUp() {
        jobRepository.deleteAll();
        outboxRepository.deleteAll();
    }

    @Test
    void configurationIsLoaded() {
        assertEquals(4, properties.getAlerts().getBreakerCeiling());
        assertEquals(3, properties.getOutbox().getMaxAttempts());
        assertTrue(properties.getProcesses().containsKey("herald"));
        assertFalse(properties.getScheduler().isEnabled());
    }

    @Test
    void oneShotJobRunsExactlyOnce() throws InterruptedException {
        Job job = jobStore.create(Job.builder()
                .id("remind-once")
                .name("Dentist reminder")
                .schedule(JobSchedule.once(Instant.now().minusSeconds(5)))
                .action(JobAction.notify("telegram", "4242", "{{job_name}} (run {{run}})"))
                .enabled(true)
                .source("test")
                .build());

        assertEquals(1, jobScheduler.runDueJobs(Instant.now()));
        awaitIdle(job.getId());
        assertEquals(0, jobScheduler.runDueJobs(Instant.now()));

        Job after = jobStore.get(job.getId()).orElseThrow();
        assertEquals(1, after.getRunCount());
        assertFalse(after.isEnabled());
        assertNull(after.getNextRunAt());
        assertEquals(OutcomeStatus.SUCCESS, after.getLastOutcome());

        OutboxMessage message = outboxRepository.findByDedupKey("job:remind-once:run:1").orElseThrow();
        assertEquals("Dentist reminder (run 1)", message.getBody());
        assertEquals(1, outboxRepository.count());
    }

    private void awaitIdle(String jobId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (jobScheduler.isRunning(jobId) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertFalse(jobScheduler.isRunning(jobId), "job still running after 5s");
    }
}
