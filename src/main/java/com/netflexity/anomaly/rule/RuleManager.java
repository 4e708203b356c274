package com.netflexity.anomaly.rule;

import com.netflexity.anomaly.config.RuleConfig;
import com.netflexity.anomaly.notification.NotificationDispatcher;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scheduled rule runner.
 *
 * Builds the configured rules once, evaluates every rule that is due on each
 * tick, and sends the rule's alerts through the notification dispatcher after
 * a successful evaluation. Rules evaluate in parallel on a bounded pool; a rule
 * whose previous evaluation is still running is skipped for the tick.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Component
@ConditionalOnProperty(prefix = "anomaly.rules", name = "enabled", havingValue = "true")
@Slf4j
public class RuleManager {

    private final RuleConfig ruleConfig;
    private final NotificationDispatcher notificationDispatcher;
    private final Map<String, AnomalyRule> rules;
    private final Map<String, Instant> lastEvaluated = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final ExecutorService executor;

    public RuleManager(RuleConfig ruleConfig,
                       RuleDependencies ruleDependencies,
                       NotificationDispatcher notificationDispatcher,
                       MeterRegistry meterRegistry) {
        this.ruleConfig = ruleConfig;
        this.notificationDispatcher = notificationDispatcher;

        ruleConfig.applyDefaults();
        this.rules = Collections.unmodifiableMap(buildRules(ruleConfig, ruleDependencies));
        this.rules.values().forEach(rule -> registerActiveAlertsGauge(rule, meterRegistry));

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(ruleConfig.getWorkerThreads(), runnable -> {
            Thread thread = new Thread(runnable, "rule-eval-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        log.info("RuleManager initialized with {} rules on {} worker threads",
                rules.size(), ruleConfig.getWorkerThreads());
    }

    /**
     * Scheduled rule evaluation
     */
    @Scheduled(fixedDelayString = "${anomaly.rules.evaluation-interval-seconds:60}000")
    public void runEvaluations() {
        Instant ts = Instant.now();
        int submitted = 0;

        for (AnomalyRule rule : rules.values()) {
            if (!isDue(rule, ts)) {
                continue;
            }
            if (!inFlight.add(rule.getId())) {
                log.warn("Previous evaluation of rule {} is still running, skipping tick at {}", rule.getId(), ts);
                continue;
            }
            try {
                executor.execute(() -> {
                    try {
                        evaluate(rule, ts);
                    } finally {
                        inFlight.remove(rule.getId());
                    }
                });
                submitted++;
            } catch (RejectedExecutionException e) {
                inFlight.remove(rule.getId());
                log.warn("Evaluation of rule {} rejected: {}", rule.getId(), e.getMessage());
            }
        }

        log.debug("Submitted {} of {} rules for evaluation at {}", submitted, rules.size(), ts);
    }

    /**
     * Evaluate one rule at {@code ts} and send its due alerts
     *
     * @return true when the evaluation succeeded
     */
    public boolean evaluate(AnomalyRule rule, Instant ts) {
        lastEvaluated.put(rule.getId(), ts);
        EvaluationContext ctx = EvaluationContext.withTimeout(ruleConfig.getEvaluationTimeout());
        try {
            rule.eval(ctx, ts);
        } catch (RuleEvaluationException e) {
            // already logged and recorded by the rule
            return false;
        } catch (RuntimeException e) {
            log.error("Unexpected error evaluating rule {}: {}", rule.getId(), e.getMessage(), e);
            return false;
        } finally {
            ctx.cancel();
        }

        try {
            rule.sendAlerts(ts, ruleConfig.getResendDelay(), rule.getFrequency(), notificationDispatcher);
        } catch (RuntimeException e) {
            log.error("Error sending alerts of rule {}: {}", rule.getId(), e.getMessage(), e);
        }
        return true;
    }

    /**
     * A rule is due once its frequency has elapsed since its last evaluation
     */
    boolean isDue(AnomalyRule rule, Instant ts) {
        Instant last = lastEvaluated.get(rule.getId());
        return last == null || Duration.between(last, ts).compareTo(rule.getFrequency()) >= 0;
    }

    public List<AnomalyRule> getRules() {
        return new ArrayList<>(rules.values());
    }

    public Optional<AnomalyRule> findRule(String id) {
        return Optional.ofNullable(rules.get(id));
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down rule evaluation pool");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(ruleConfig.getEvaluationTimeoutSeconds(), TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Map<String, AnomalyRule> buildRules(RuleConfig ruleConfig, RuleDependencies dependencies) {
        RuleOptions options = ruleConfig.toRuleOptions();
        Map<String, AnomalyRule> built = new LinkedHashMap<>();

        for (RuleDefinition definition : ruleConfig.getEnabledDefinitions()) {
            if (built.containsKey(definition.getId())) {
                log.error("Duplicate rule id {}, skipping rule '{}'", definition.getId(), definition.getAlertName());
                continue;
            }
            try {
                built.put(definition.getId(), new AnomalyRule(definition, options, dependencies));
                log.info("Loaded rule {} ({})", definition.getId(), definition.getAlertName());
            } catch (InvalidRuleException e) {
                log.error("Invalid rule {} skipped: {}", definition.getId(), e.getMessage());
            }
        }
        return built;
    }

    private static void registerActiveAlertsGauge(AnomalyRule rule, MeterRegistry meterRegistry) {
        Gauge.builder("anomaly_rule_active_alerts", rule, r -> r.activeAlerts().size())
                .description("Number of pending and firing alerts of the rule")
                .tag("rule", rule.getId())
                .register(meterRegistry);
    }
}
