package com.example.almanac.controller;

import com.example.almanac.common.ConfigException;
import com.example.almanac.domain.OutboxMessage;
import com.example.almanac.outbox.DeliveryOutcome;
import com.example.almanac.outbox.OutboxService;
import com.example.almanac.outbox.OutboxStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Outbox REST API: inspection, manual requeue, and delivery reports from external adapters.
 */
@RestController
@RequestMapping("/api/outbox")
@RequiredArgsConstructor
public class OutboxController {

    private final OutboxService outboxService;

    @GetMapping
    public ResponseEntity<?> list(@RequestParam(required = false) String status,
                                  @RequestParam(defaultValue = "100") int limit) {
        try {
            OutboxStatus parsed = status != null ? OutboxStatus.valueOf(status.toUpperCase()) : null;
            return ResponseEntity.ok(outboxService.list(parsed, limit));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown status: " + status));
        }
    }

    @GetMapping("/pending")
    public ResponseEntity<List<OutboxMessage>> pending() {
        return ResponseEntity.ok(outboxService.pending());
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Long>> stats() {
        return ResponseEntity.ok(Map.of(
                "pending", outboxService.countByStatus(OutboxStatus.PENDING),
                "sent", outboxService.countByStatus(OutboxStatus.SENT),
                "failed", outboxService.countByStatus(OutboxStatus.FAILED)
        ));
    }

    @GetMapping("/{id}")
    public ResponseEntity<OutboxMessage> get(@PathVariable long id) {
        return outboxService.get(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<?> enqueue(@RequestBody EnqueueRequest request) {
        try {
            long id = outboxService.enqueue(request.channel(), request.target(), request.body(),
                    request.sender() != null ? request.sender() : "api", request.dedupKey());
            return ResponseEntity.ok(Map.of("id", id));
        } catch (ConfigException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<?> retry(@PathVariable long id) {
        try {
            return outboxService.retry(id)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElse(ResponseEntity.notFound().build());
        } catch (IllegalStateException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/{id}/outcome")
    public ResponseEntity<?> recordOutcome(@PathVariable long id, @RequestBody DeliveryOutcome outcome) {
        return outboxService.recordOutcome(id, outcome)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    public record EnqueueRequest(String channel, String target, String body, String sender, String dedupKey) {}
}
