package com.example.almanac.controller;

import com.example.almanac.domain.EventLogEntry;
import com.example.almanac.eventlog.EventLevel;
import com.example.almanac.eventlog.EventLogService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Event log read/write API for the other processes of the platform.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventLogController {

    private final EventLogService eventLogService;
    private final Clock clock;

    @GetMapping
    public ResponseEntity<?> query(@RequestParam(required = false) String source,
                                   @RequestParam(required = false) String level,
                                   @RequestParam(required = false) Instant since,
                                   @RequestParam(required = false) Instant until,
                                   @RequestParam(defaultValue = "0") int page) {
        Instant end = until != null ? until : clock.instant();
        Instant start = since != null ? since : end.minus(Duration.ofHours(1));
        try {
            EventLevel parsedLevel = level != null ? EventLevel.parse(level) : null;
            List<EventLogEntry> events = eventLogService.query(source, parsedLevel, start, end, page);
            ResponseEntity.BodyBuilder response = ResponseEntity.ok();
            if (events.size() >= eventLogService.queryLimit()) {
                // a full page, there may be more
                response.header("X-Next-Page", Integer.toString(Math.max(0, page) + 1));
            }
            return response.body(events);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown level: " + level));
        }
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> append(@RequestBody AppendRequest request) {
        if (request.source() == null || request.source().isBlank() || request.message() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "source and message are required"));
        }
        try {
            EventLevel level = request.level() != null ? EventLevel.parse(request.level()) : EventLevel.INFO;
            eventLogService.append(level, request.source(), request.message(), request.fields());
            return ResponseEntity.ok(Map.of("status", "appended"));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown level: " + request.level()));
        }
    }

    public record AppendRequest(String level, String source, String message, Map<String, Object> fields) {}
}
