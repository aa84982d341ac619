package com.example.almanac.controller;

import com.example.almanac.alert.AlertRuleService;
import com.example.almanac.common.ConfigException;
import com.example.almanac.domain.AlertHistoryEntry;
import com.example.almanac.domain.AlertRule;
import com.example.almanac.domain.AlertState;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Alert rules, their state and firing history.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final AlertRuleService alertRuleService;

    @GetMapping
    public ResponseEntity<List<AlertRule>> listAlertRules() {
        return ResponseEntity.ok(alertRuleService.list());
    }

    @PostMapping
    public ResponseEntity<?> createAlertRule(@RequestBody AlertRule rule) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(alertRuleService.create(rule));
        } catch (ConfigException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/states")
    public ResponseEntity<List<AlertState>> listStates() {
        return ResponseEntity.ok(alertRuleService.states());
    }

    @GetMapping("/history")
    public ResponseEntity<List<AlertHistoryEntry>> history(@RequestParam(required = false) String ruleId,
                                                           @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(alertRuleService.history(ruleId, limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AlertRule> getAlertRule(@PathVariable String id) {
        return alertRuleService.get(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> updateAlertRule(@PathVariable String id, @RequestBody AlertRule rule) {
        try {
            return alertRuleService.update(id, rule)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElse(ResponseEntity.notFound().build());
        } catch (ConfigException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> deleteAlertRule(@PathVariable String id) {
        if (!alertRuleService.delete(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "id", id));
    }

    @PostMapping("/{id}/enable")
    public ResponseEntity<AlertRule> enable(@PathVariable String id) {
        return alertRuleService.setEnabled(id, true)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/disable")
    public ResponseEntity<AlertRule> disable(@PathVariable String id) {
        return alertRuleService.setEnabled(id, false)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/state")
    public ResponseEntity<AlertState> state(@PathVariable String id) {
        return alertRuleService.state(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
