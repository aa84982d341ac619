package com.example.almanac.outbox;

import com.example.almanac.config.AlmanacProperties;
import com.example.almanac.domain.OutboxMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Delivery loop of the outbox.
 *
 * Each pass picks the lanes, keyed by (channel, target), whose oldest pending message is due.
 * Lanes run in parallel on the dispatch pool; messages inside a lane go one by one in id order, and a lane stops at the first
 * message that is not due yet or fails, so a target never sees messages out of order.
 */
@Slf4j
@Component
public class OutboxDispatcher {

    private final OutboxService outboxService;
    private final AlmanacProperties properties;
    private final Executor dispatchExecutor;
    private final Clock clock;
    private final Map<String, ChannelAdapter> adapters;

    public OutboxDispatcher(OutboxService outboxService,
                            AlmanacProperties properties,
                            @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                            Clock clock,
                            List<ChannelAdapter> adapters) {
        this.outboxService = outboxService;
        this.properties = properties;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
        this.adapters = adapters.stream()
                .collect(Collectors.toMap(ChannelAdapter::channel, Function.identity(), (a, b) -> a));
        log.info("Outbox channel adapters: {}", this.adapters.keySet());
    }

    @Scheduled(fixedDelayString = "${almanac.outbox.poll-millis:2000}", initialDelay = 5000)
    public void tick() {
        if (!properties.getOutbox().isEnabled()) return;
        try {
            dispatchPending(clock.instant());
        } catch (Exception e) {
            log.error("Outbox dispatch pass failed: {}", e.getMessage(), e);
        }
    }

    /**
     * One dispatch pass.
     *
     * @return number of messages delivered
     */
    public int dispatchPending(Instant now) {
        Map<OutboxLane, List<OutboxMessage>> lanes = outboxService.dueLanes(now);
        if (lanes.isEmpty()) return 0;

        List<CompletableFuture<Integer>> futures = lanes.entrySet().stream()
                .map(lane -> CompletableFuture.supplyAsync(() -> dispatchLane(lane.getValue(), now), dispatchExecutor)
                        .exceptionally(ex -> {
                            log.error("Outbox lane {} failed: {}", lane.getKey(), ex.getMessage());
                            return 0;
                        }))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        int delivered = futures.stream().mapToInt(CompletableFuture::join).sum();
        if (delivered > 0) {
            log.debug("Outbox pass delivered {} message(s) across {} lane(s)", delivered, lanes.size());
        }
        return delivered;
    }

    private int dispatchLane(List<OutboxMessage> lane, Instant now) {
        int delivered = 0;
        for (OutboxMessage message : lane) {
            if (message.getNextAttemptAt() != null && message.getNextAttemptAt().isAfter(now)) {
                break;
            }
            Attempt attempt = deliver(message, now);
            if (attempt == Attempt.SENT) {
                delivered++;
            } else if (attempt == Attempt.RETRY) {
                break;
            }
        }
        return delivered;
    }

    private Attempt deliver(OutboxMessage message, Instant now) {
        ChannelAdapter adapter = adapters.get(message.getChannel());
        if (adapter == null) {
            outboxService.markFailedAttempt(message.getId(),
                    "No adapter for channel '" + message.getChannel() + "'", false, now);
            return Attempt.RETRY;
        }
        try {
            adapter.deliver(message.getTarget(), message.getBody());
            outboxService.markSent(message.getId(), now);
            return Attempt.SENT;
        } catch (DeliveryException e) {
            outboxService.markFailedAttempt(message.getId(), e.getMessage(), e.isPermanent(), now);
            return e.isPermanent() ? Attempt.DROPPED : Attempt.RETRY;
        } catch (Exception e) {
            outboxService.markFailedAttempt(message.getId(),
                    e.getClass().getSimpleName() + ": " + e.getMessage(), false, now);
            return Attempt.RETRY;
        }
    }

    /** DROPPED: permanently failed, the lane may move on. */
    private enum Attempt { SENT, RETRY, DROPPED }
}
