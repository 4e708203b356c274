package com.netflexity.anomaly.health;

import com.netflexity.anomaly.rule.AnomalyRule;
import com.netflexity.anomaly.rule.RuleHealth;
import com.netflexity.anomaly.rule.RuleManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for rule evaluation.
 *
 * Reports UP while no rule failed its last evaluation, and DEGRADED with the
 * last error of each failing rule otherwise. A failing rule never takes the
 * service down; the other rules keep evaluating.
 *
 * The health check results are exposed via /actuator/health under "rules"
 */
@Component("rules")
@ConditionalOnProperty(prefix = "anomaly.rules", name = "enabled", havingValue = "true")
@Slf4j
public class RuleEngineHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "One or more rules failed their last evaluation");

    private final RuleManager ruleManager;

    public RuleEngineHealthIndicator(RuleManager ruleManager) {
        this.ruleManager = ruleManager;
        log.info("Initialized RuleEngineHealthIndicator");
    }

    @Override
    public Health health() {
        List<AnomalyRule> rules = ruleManager.getRules();

        Map<String, Object> failing = new LinkedHashMap<>();
        int unknown = 0;
        for (AnomalyRule rule : rules) {
            RuleHealth health = rule.getHealth();
            if (health == RuleHealth.BAD) {
                failing.put(rule.getId(), rule.getLastError() != null ? rule.getLastError() : "unknown error");
            } else if (health == RuleHealth.UNKNOWN) {
                unknown++;
            }
        }

        Health.Builder builder = failing.isEmpty() ? Health.up() : Health.status(DEGRADED);
        builder.withDetail("rules", rules.size())
                .withDetail("failing", failing.size())
                .withDetail("notYetEvaluated", unknown);
        if (!failing.isEmpty()) {
            builder.withDetail("errors", failing);
        }
        return builder.build();
    }
}
