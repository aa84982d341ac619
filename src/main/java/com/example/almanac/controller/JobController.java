package com.example.almanac.controller;

import com.example.almanac.common.ConfigException;
import com.example.almanac.domain.Job;
import com.example.almanac.scheduler.JobScheduler;
import com.example.almanac.scheduler.JobStore;
import com.example.almanac.scheduler.TriggerResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Job configuration API.
 */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobStore jobStore;
    private final JobScheduler jobScheduler;

    @GetMapping
    public ResponseEntity<List<Job>> list(@RequestParam(required = false) String tag) {
        return ResponseEntity.ok(jobStore.list(tag));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Job> get(@PathVariable String id) {
        return jobStore.get(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody Job job) {
        try {
            if (job.getSource() == null) job.setSource("api");
            return ResponseEntity.status(HttpStatus.CREATED).body(jobStore.create(job));
        } catch (ConfigException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> update(@PathVariable String id, @RequestBody Job changes) {
        try {
            return jobStore.update(id, changes)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElse(ResponseEntity.notFound().build());
        } catch (ConfigException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String id) {
        if (!jobStore.delete(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "id", id));
    }

    @PostMapping("/{id}/enable")
    public ResponseEntity<?> enable(@PathVariable String id) {
        return toggle(id, true);
    }

    @PostMapping("/{id}/disable")
    public ResponseEntity<?> disable(@PathVariable String id) {
        return toggle(id, false);
    }

    @PostMapping("/{id}/trigger")
    public ResponseEntity<Map<String, String>> trigger(@PathVariable String id) {
        TriggerResult result = jobScheduler.triggerNow(id);
        return switch (result) {
            case STARTED -> ResponseEntity.accepted().body(Map.of("status", "started", "id", id));
            case ALREADY_RUNNING -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("status", "already_running", "id", id));
            case NOT_FOUND -> ResponseEntity.notFound().build();
        };
    }

    private ResponseEntity<?> toggle(String id, boolean enabled) {
        try {
            return jobStore.setEnabled(id, enabled)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElse(ResponseEntity.notFound().build());
        } catch (ConfigException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
