package com.example.almanac.outbox;

import com.example.almanac.common.ConfigException;
import com.example.almanac.config.AlmanacProperties;
import com.example.almanac.domain.OutboxMessage;
import com.example.almanac.repository.OutboxRepository;
import com.example.almanac.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class OutboxDispatcherTest {

    private static final Instant T0 = Instant.parse("2026-03-10T12:00:00Z");

    @Autowired
    private OutboxRepository repository;

    private final MutableClock clock = new MutableClock(T0);
    private final AlmanacProperties properties = new AlmanacProperties();
    private final RecordingAdapter adapter = new RecordingAdapter();
    private OutboxService outboxService;
    private OutboxDispatcher dispatcher;

    /** Delivers to an in-memory list; fails the next N calls when told to. */
    static class RecordingAdapter implements ChannelAdapter {
        final List<String> delivered = new ArrayList<>();
        final AtomicInteger calls = new AtomicInteger();
        int failuresLeft;
        String failTarget;
        boolean permanent;

        @Override
        public String channel() {
            return "telegram";
        }

        @Override
        public void deliver(String target, String body) {
            calls.incrementAndGet();
            if (failuresLeft > 0 && (failTarget == null || failTarget.equals(target))) {
                failuresLeft--;
                throw new DeliveryException("simulated failure", permanent);
            }
            delivered.add(target + ":" + body);
        }
    }

    @BeforeEach
    void setUp() {
        clock.set(T0);
        properties.getOutbox().setMaxAttempts(3);
        properties.getOutbox().setBaseBackoffSeconds(2);
        properties.getOutbox().setMaxBackoffSeconds(60);
        outboxService = new OutboxService(repository, properties, new SimpleMeterRegistry(), clock);
        dispatcher = new OutboxDispatcher(outboxService, properties, Runnable::run, clock, List.of(adapter));
    }

    @Test
    void deliversPendingMessageOnce() {
        long id = outboxService.enqueue("telegram", "42", "hello", "test");

        assertEquals(1, dispatcher.dispatchPending(T0));
        assertEquals(0, dispatcher.dispatchPending(T0.plusSeconds(10)));

        OutboxMessage sent = repository.findById(id).orElseThrow();
        assertEquals(OutboxStatus.SENT, sent.getStatus());
        assertEquals(1, sent.getAttempts());
        assertEquals(T0, sent.getSentAt());
        assertEquals(List.of("42:hello"), adapter.delivered);
    }

    @Test
    void succeedsOnThirdAttemptAfterBackoff() {
        adapter.failuresLeft = 2;
        long id = outboxService.enqueue("telegram", "42", "retry me", "test");

        dispatcher.dispatchPending(T0);
        OutboxMessage afterFirst = repository.findById(id).orElseThrow();
        assertEquals(OutboxStatus.PENDING, afterFirst.getStatus());
        assertEquals(1, afterFirst.getAttempts());
        assertEquals(T0.plusSeconds(2), afterFirst.getNextAttemptAt());
        assertEquals("simulated failure", afterFirst.getLastError());

        // not due yet
        dispatcher.dispatchPending(T0.plusSeconds(1));
        assertEquals(1, adapter.calls.get());

        dispatcher.dispatchPending(T0.plusSeconds(2));
        OutboxMessage afterSecond = repository.findById(id).orElseThrow();
        assertEquals(2, afterSecond.getAttempts());
        assertEquals(T0.plusSeconds(2 + 4), afterSecond.getNextAttemptAt());

        assertEquals(1, dispatcher.dispatchPending(T0.plusSeconds(6)));
        OutboxMessage sent = repository.findById(id).orElseThrow();
        assertEquals(OutboxStatus.SENT, sent.getStatus());
        assertEquals(3, sent.getAttempts());
        assertEquals(T0.plusSeconds(6), sent.getSentAt());
    }

    @Test
    void failsAfterMaxAttemptsAndIsKept() {
        adapter.failuresLeft = Integer.MAX_VALUE;
        long id = outboxService.enqueue("telegram", "42", "doomed", "test");

        Instant now = T0;
        for (int i = 0; i < 3; i++) {
            dispatcher.dispatchPending(now);
            now = now.plus(Duration.ofMinutes(5));
        }
        dispatcher.dispatchPending(now);

        OutboxMessage failed = repository.findById(id).orElseThrow();
        assertEquals(OutboxStatus.FAILED, failed.getStatus());
        assertEquals(3, failed.getAttempts());
        assertNull(failed.getSentAt());
        assertEquals(3, adapter.calls.get());
    }

    @Test
    void permanentErrorFailsImmediately() {
        adapter.failuresLeft = 1;
        adapter.permanent = true;
        long id = outboxService.enqueue("telegram", "42", "bad chat", "test");

        dispatcher.dispatchPending(T0);

        OutboxMessage failed = repository.findById(id).orElseThrow();
        assertEquals(OutboxStatus.FAILED, failed.getStatus());
        assertEquals(1, failed.getAttempts());
    }

    @Test
    void failureHoldsBackLaterMessagesForTheSameTargetOnly() {
        adapter.failuresLeft = 1;
        adapter.failTarget = "A";
        outboxService.enqueue("telegram", "A", "a1", "test");
        outboxService.enqueue("telegram", "A", "a2", "test");
        outboxService.enqueue("telegram", "B", "b1", "test");

        assertEquals(1, dispatcher.dispatchPending(T0));
        assertEquals(List.of("B:b1"), adapter.delivered);

        assertEquals(2, dispatcher.dispatchPending(T0.plusSeconds(2)));
        assertEquals(List.of("B:b1", "A:a1", "A:a2"), adapter.delivered);
    }

    @Test
    void backedUpTargetDoesNotStarveOtherTargets() {
        properties.getOutbox().setBatchSize(5);
        adapter.failuresLeft = Integer.MAX_VALUE;
        adapter.failTarget = "dead";
        for (int i = 0; i < 12; i++) {
            outboxService.enqueue("telegram", "dead", "d" + i, "test");
        }
        outboxService.enqueue("telegram", "alive", "still here", "test");

        assertEquals(1, dispatcher.dispatchPending(T0));
        assertEquals(List.of("alive:still here"), adapter.delivered);
        // the dead lane stopped at its head
        assertEquals(2, adapter.calls.get());

        outboxService.enqueue("telegram", "alive", "again", "test");
        assertEquals(1, dispatcher.dispatchPending(T0.plusSeconds(1)));
        assertEquals(List.of("alive:still here", "alive:again"), adapter.delivered);
        assertEquals(3, adapter.calls.get());
    }

    @Test
    void laneInBackoffIsNotSelected() {
        adapter.failuresLeft = 1;
        long head = outboxService.enqueue("telegram", "A", "a1", "test");
        outboxService.enqueue("telegram", "A", "a2", "test");
        dispatcher.dispatchPending(T0);

        assertTrue(outboxService.dueLanes(T0.plusSeconds(1)).isEmpty());

        Map<OutboxLane, List<OutboxMessage>> lanes = outboxService.dueLanes(T0.plusSeconds(2));
        assertEquals(1, lanes.size());
        List<OutboxMessage> lane = lanes.get(new OutboxLane("telegram", "A"));
        assertEquals(head, lane.get(0).getId());
        assertEquals(2, lane.size());
    }

    @Test
    void permanentFailureDoesNotBlockTheLane() {
        adapter.failuresLeft = 1;
        adapter.permanent = true;
        outboxService.enqueue("telegram", "A", "a1", "test");
        outboxService.enqueue("telegram", "A", "a2", "test");

        assertEquals(1, dispatcher.dispatchPending(T0));
        assertEquals(List.of("A:a2"), adapter.delivered);
    }

    @Test
    void missingAdapterIsRetryableUntilFailed() {
        long id = outboxService.enqueue("carrier-pigeon", "coop", "coo", "test");

        Instant now = T0;
        for (int i = 0; i < 3; i++) {
            dispatcher.dispatchPending(now);
            now = now.plus(Duration.ofMinutes(5));
        }

        OutboxMessage failed = repository.findById(id).orElseThrow();
        assertEquals(OutboxStatus.FAILED, failed.getStatus());
        assertTrue(failed.getLastError().contains("carrier-pigeon"));
    }

    @Test
    void dedupKeyReturnsExistingMessage() {
        long first = outboxService.enqueue("telegram", "42", "once", "test", "job:backup:run:1");
        long second = outboxService.enqueue("telegram", "42", "once again", "test", "job:backup:run:1");

        assertEquals(first, second);
        assertEquals(1, repository.count());
        assertEquals("once", repository.findById(first).orElseThrow().getBody());
    }

    @Test
    void enqueueValidatesInput() {
        assertThrows(ConfigException.class, () -> outboxService.enqueue("", "42", "x", "test"));
        assertThrows(ConfigException.class, () -> outboxService.enqueue("telegram", null, "x", "test"));
        assertThrows(ConfigException.class, () -> outboxService.enqueue("telegram", "42", "", "test"));
    }

    @Test
    void retryRequeuesFailedMessage() {
        adapter.failuresLeft = 1;
        adapter.permanent = true;
        long id = outboxService.enqueue("telegram", "42", "second chance", "test");
        dispatcher.dispatchPending(T0);

        clock.set(T0.plusSeconds(30));
        OutboxMessage requeued = outboxService.retry(id).orElseThrow();
        assertEquals(OutboxStatus.PENDING, requeued.getStatus());
        assertEquals(0, requeued.getAttempts());

        assertEquals(1, dispatcher.dispatchPending(T0.plusSeconds(30)));
        assertEquals(OutboxStatus.SENT, repository.findById(id).orElseThrow().getStatus());
        assertThrows(IllegalStateException.class, () -> outboxService.retry(id));
        assertTrue(outboxService.retry(9999).isEmpty());
    }

    @Test
    void externalOutcomeReports() {
        long ok = outboxService.enqueue("telegram", "42", "external", "test");
        long bad = outboxService.enqueue("telegram", "43", "external", "test");

        assertEquals(OutboxStatus.SENT, outboxService.recordOutcome(ok, DeliveryOutcome.sent()).orElseThrow().getStatus());
        OutboxMessage failed = outboxService.recordOutcome(bad, DeliveryOutcome.permanentFailure("chat not found")).orElseThrow();
        assertEquals(OutboxStatus.FAILED, failed.getStatus());
        assertEquals("chat not found", failed.getLastError());

        // a late duplicate report does not move sentAt
        Instant sentAt = repository.findById(ok).orElseThrow().getSentAt();
        clock.advance(Duration.ofMinutes(1));
        outboxService.recordOutcome(ok, DeliveryOutcome.sent());
        assertEquals(sentAt, repository.findById(ok).orElseThrow().getSentAt());
    }

    @Test
    void backoffIsExponentialAndCapped() {
        assertEquals(Duration.ofSeconds(2), outboxService.backoff(1));
        assertEquals(Duration.ofSeconds(4), outboxService.backoff(2));
        assertEquals(Duration.ofSeconds(8), outboxService.backoff(3));
        assertEquals(Duration.ofSeconds(60), outboxService.backoff(10));
        assertEquals(Duration.ofSeconds(60), outboxService.backoff(500));
    }
}
