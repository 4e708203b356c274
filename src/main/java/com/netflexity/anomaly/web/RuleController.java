package com.netflexity.anomaly.web;

import com.netflexity.anomaly.notification.AlertNotification;
import com.netflexity.anomaly.notification.NotificationDispatcher;
import com.netflexity.anomaly.rule.Alert;
import com.netflexity.anomaly.rule.AnomalyRule;
import com.netflexity.anomaly.rule.Labels;
import com.netflexity.anomaly.rule.RuleManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST API controller for rule status.
 *
 * Provides endpoints for viewing rule definitions, evaluation health and
 * tracked alerts, and for test-firing a rule's notification channels.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@RestController
@RequestMapping("/api")
@ConditionalOnProperty(prefix = "anomaly.rules", name = "enabled", havingValue = "true")
@Slf4j
public class RuleController {

    private final RuleManager ruleManager;
    private final NotificationDispatcher notificationDispatcher;

    public RuleController(RuleManager ruleManager, NotificationDispatcher notificationDispatcher) {
        this.ruleManager = ruleManager;
        this.notificationDispatcher = notificationDispatcher;
    }

    /**
     * List all rules with their current state
     */
    @GetMapping("/rules")
    public ResponseEntity<?> getRules() {
        Map<String, Object> response = new HashMap<>();
        response.put("rules", ruleManager.getRules().stream().map(RuleController::summarize).toList());
        response.put("timestamp", Instant.now());
        return ResponseEntity.ok(response);
    }

    /**
     * Get one rule with its definition
     */
    @GetMapping("/rules/{id}")
    public ResponseEntity<?> getRule(@PathVariable String id) {
        Optional<AnomalyRule> rule = ruleManager.findRule(id);
        if (rule.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        Map<String, Object> response = summarize(rule.get());
        response.put("definition", rule.get().getDefinition());
        response.put("generatorUrl", rule.get().getGeneratorUrl());
        response.put("timestamp", Instant.now());
        return ResponseEntity.ok(response);
    }

    /**
     * Get the alerts tracked by a rule, resolved ones included
     */
    @GetMapping("/rules/{id}/alerts")
    public ResponseEntity<?> getAlerts(@PathVariable String id) {
        Optional<AnomalyRule> rule = ruleManager.findRule(id);
        if (rule.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        List<Alert> alerts = rule.get().currentAlerts();
        Map<String, Object> response = new HashMap<>();
        response.put("ruleId", id);
        response.put("state", rule.get().getState().getLabel());
        response.put("alerts", alerts);
        response.put("timestamp", Instant.now());
        return ResponseEntity.ok(response);
    }

    /**
     * Test-fire a rule notification
     */
    @PostMapping("/rules/{id}/test")
    public ResponseEntity<?> testRule(@PathVariable String id) {
        Optional<AnomalyRule> found = ruleManager.findRule(id);
        if (found.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        AnomalyRule rule = found.get();

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(Labels.ALERT_NAME, rule.getName());
        labels.put(Labels.RULE_ID, rule.getId());
        labels.put("test", "true");

        AlertNotification notification = AlertNotification.builder()
                .ruleId(rule.getId())
                .alertName(rule.getName())
                .status(AlertNotification.STATUS_FIRING)
                .labels(labels)
                .annotations(Map.of("summary", "This is a test notification from the REST API"))
                .value(rule.getCondition().targetValue())
                .generatorUrl(rule.getGeneratorUrl())
                .fingerprint("test")
                .startsAt(Instant.now())
                .receivers(rule.getPreferredChannels())
                .build();

        int delivered = notificationDispatcher.dispatch(notification);

        Map<String, Object> response = new HashMap<>();
        response.put("success", delivered > 0);
        response.put("ruleId", id);
        response.put("delivered", delivered);
        response.put("channels", rule.getPreferredChannels().isEmpty()
                ? notificationDispatcher.getChannels().keySet()
                : rule.getPreferredChannels());
        response.put("timestamp", Instant.now());
        log.info("Test notification of rule {} delivered to {} channels", id, delivered);
        return ResponseEntity.ok(response);
    }

    private static Map<String, Object> summarize(AnomalyRule rule) {
        Map<String, Object> summary = new HashMap<>();
        summary.put("id", rule.getId());
        summary.put("name", rule.getName());
        summary.put("state", rule.getState().getLabel());
        summary.put("health", rule.getHealth().getValue());
        summary.put("lastError", rule.getLastError());
        summary.put("lastEvaluation", rule.getEvaluationTimestamp());
        summary.put("evaluationDurationMillis", rule.getEvaluationDuration().toMillis());
        summary.put("activeAlerts", rule.activeAlerts().size());
        summary.put("frequency", rule.getFrequency().toString());
        return summary;
    }
}
