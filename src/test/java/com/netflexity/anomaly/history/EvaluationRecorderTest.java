package com.netflexity.anomaly.history;

import com.netflexity.anomaly.rule.EvaluationContext;
import com.netflexity.anomaly.rule.RuleEvaluationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class EvaluationRecorderTest {

    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
    }

    private static List<RuleStateHistory> records() {
        return List.of(RuleStateHistory.builder()
                .ruleId("rule-1")
                .state(RuleStateHistory.STATE_FIRING)
                .stateChanged(true)
                .unixMilli(1_715_342_400_000L)
                .labels("{\"service\":\"checkout\"}")
                .value(3.0)
                .build());
    }

    @Test
    void persistForwardsRecordsToStore() {
        List<RuleStateHistory> stored = new ArrayList<>();
        EvaluationRecorder recorder = new EvaluationRecorder(batch -> {
            stored.addAll(batch);
            return Mono.empty();
        }, meterRegistry, Duration.ofSeconds(1));

        recorder.persist(EvaluationContext.background(), "rule-1", records());

        assertThat(stored).hasSize(1);
        assertThat(meterRegistry.find("anomaly_rule_history_failures_total").counter()).isNull();
    }

    @Test
    void storeFailureIsCountedAndSwallowed() {
        EvaluationRecorder recorder = new EvaluationRecorder(
                batch -> Mono.error(new IllegalStateException("history endpoint down")),
                meterRegistry, Duration.ofSeconds(1));

        assertThatCode(() -> recorder.persist(EvaluationContext.background(), "rule-1", records())).doesNotThrowAnyException();

        assertThat(meterRegistry.get("anomaly_rule_history_failures_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void slowStoreTimesOut() {
        EvaluationRecorder recorder = new EvaluationRecorder(batch -> Mono.never(),
                meterRegistry, Duration.ofMillis(100));

        recorder.persist(EvaluationContext.background(), "rule-1", records());

        assertThat(meterRegistry.get("anomaly_rule_history_failures_total").tag("kind", "backend")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void contextDeadlineEndsSlowWrite() {
        EvaluationRecorder recorder = new EvaluationRecorder(batch -> Mono.never(),
                meterRegistry, Duration.ofSeconds(5));
        EvaluationContext ctx = EvaluationContext.withTimeout(Duration.ofMillis(200));

        long started = System.nanoTime();
        assertThatCode(() -> recorder.persist(ctx, "rule-1", records())).doesNotThrowAnyException();

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(2));
        assertThat(meterRegistry.get("anomaly_rule_history_failures_total").tag("kind", "cancelled")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void cancelledContextSkipsWrite() {
        List<List<RuleStateHistory>> calls = new ArrayList<>();
        EvaluationRecorder recorder = new EvaluationRecorder(batch -> {
            calls.add(batch);
            return Mono.empty();
        }, meterRegistry, Duration.ofSeconds(1));
        EvaluationContext ctx = EvaluationContext.background();
        ctx.cancel();

        recorder.persist(ctx, "rule-1", records());

        assertThat(calls).isEmpty();
        assertThat(meterRegistry.get("anomaly_rule_history_failures_total").tag("kind", "cancelled")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void emptyBatchAndMissingStoreAreIgnored() {
        List<List<RuleStateHistory>> calls = new ArrayList<>();
        EvaluationRecorder recorder = new EvaluationRecorder(batch -> {
            calls.add(batch);
            return Mono.empty();
        }, meterRegistry, Duration.ofSeconds(1));
        recorder.persist(EvaluationContext.background(), "rule-1", List.of());

        new EvaluationRecorder(null, new SimpleMeterRegistry(), Duration.ofSeconds(1)).persist(EvaluationContext.background(), "rule-1", records());

        assertThat(calls).isEmpty();
    }

    @Test
    void outcomesAreExportedAsMeters() {
        EvaluationRecorder recorder = new EvaluationRecorder(null, meterRegistry, Duration.ofSeconds(1));

        recorder.recordSuccess("rule-1", Duration.ofMillis(120));
        recorder.recordFailure("rule-1",
                new RuleEvaluationException(RuleEvaluationException.ErrorKind.BACKEND, "query failed"),
                Duration.ofMillis(30));

        assertThat(meterRegistry.get("anomaly_rule_evaluations_total").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("anomaly_rule_evaluation_duration_seconds").timer().count()).isEqualTo(2);
        assertThat(meterRegistry.get("anomaly_rule_evaluation_failures_total").tag("kind", "backend")
                .counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("anomaly_rule_last_evaluation_timestamp_seconds").gauge().value())
                .isGreaterThan(0);
    }
}
