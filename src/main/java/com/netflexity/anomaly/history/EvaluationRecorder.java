package com.netflexity.anomaly.history;

import com.netflexity.anomaly.rule.EvaluationContext;
import com.netflexity.anomaly.rule.RuleEvaluationException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Records the outcome of rule evaluations.
 *
 * State history is forwarded to the {@link HistoryStore} on a best-effort
 * basis: failures are logged and never reach the evaluation. Evaluation
 * outcomes are exported as Micrometer meters, with failures tagged by kind.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Slf4j
public class EvaluationRecorder {

    private final HistoryStore historyStore;
    private final MeterRegistry meterRegistry;
    private final Duration persistTimeout;
    private final Timer evaluationTimer;
    private final Counter evaluationCounter;
    private final AtomicLong lastEvaluationTimestamp = new AtomicLong(0);

    public EvaluationRecorder(HistoryStore historyStore, MeterRegistry meterRegistry, Duration persistTimeout) {
        this.historyStore = historyStore;
        this.meterRegistry = meterRegistry;
        this.persistTimeout = persistTimeout;

        this.evaluationTimer = Timer.builder("anomaly_rule_evaluation_duration_seconds")
                .description("Time spent evaluating anomaly rules")
                .register(meterRegistry);

        this.evaluationCounter = Counter.builder("anomaly_rule_evaluations_total")
                .description("Total number of rule evaluations")
                .register(meterRegistry);

        Gauge.builder("anomaly_rule_last_evaluation_timestamp_seconds", this, recorder -> recorder.lastEvaluationTimestamp.get())
                .description("Unix timestamp of the last successful rule evaluation")
                .register(meterRegistry);
    }

    /**
     * Forward state history records. Never throws.
     *
     * The write is bounded by the persist timeout and by the tick's context,
     * whichever ends first.
     */
    public void persist(EvaluationContext ctx, String ruleId, List<RuleStateHistory> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        if (historyStore == null) {
            log.debug("No history store configured, dropping {} records of rule {}", records.size(), ruleId);
            return;
        }
        try {
            ctx.await(Mono.defer(() -> historyStore.addRuleStateHistory(records))
                            .timeout(persistTimeout)
                            .thenReturn(Boolean.TRUE),
                    "state history insert");
            log.debug("Stored {} state history records for rule {}", records.size(), ruleId);
        } catch (RuleEvaluationException e) {
            log.error("Error while inserting rule state history for rule {} ({} records): {}",
                    ruleId, records.size(), e.getMessage());
            Counter.builder("anomaly_rule_history_failures_total")
                    .description("Total number of failed history writes")
                    .tag("kind", e.getKind().name().toLowerCase())
                    .register(meterRegistry)
                    .increment();
        }
    }

    public void recordSuccess(String ruleId, Duration elapsed) {
        evaluationCounter.increment();
        evaluationTimer.record(elapsed);
        lastEvaluationTimestamp.set(System.currentTimeMillis() / 1000L);
        log.debug("Rule {} evaluated in {} ms", ruleId, elapsed.toMillis());
    }

    public void recordFailure(String ruleId, RuleEvaluationException error, Duration elapsed) {
        evaluationCounter.increment();
        evaluationTimer.record(elapsed);
        Counter.builder("anomaly_rule_evaluation_failures_total")
                .description("Total number of failed rule evaluations")
                .tag("kind", error.getKind().name().toLowerCase())
                .register(meterRegistry)
                .increment();
    }
}
