package com.netflexity.anomaly.rule;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netflexity.anomaly.history.RuleStateHistory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AlertStateMachineTest {

    private static final Instant T0 = Instant.parse("2024-05-10T12:00:00Z");

    private final AlertStateMachine machine =
            new AlertStateMachine("rule-1", "Checkout latency", Duration.ofMinutes(2), new ObjectMapper());

    private static Map<Long, Alert> matched(Instant ts, double value, String... services) {
        Map<Long, Alert> alerts = new LinkedHashMap<>();
        for (String service : services) {
            Labels labels = Labels.builder().set("service", service).set(Labels.ALERT_NAME, "Checkout latency").build();
            Alert alert = new Alert();
            alert.setLabels(labels);
            alert.setQueryResultLabels(Labels.builder().set("service", service).build());
            alert.setActiveAt(ts);
            alert.setValue(value);
            alerts.put(labels.hash(), alert);
        }
        return alerts;
    }

    @Test
    void newMatchStartsPending() {
        TransitionResult result = machine.apply(matched(T0, 3, "checkout"), T0);

        assertThat(result.getPreviousState()).isEqualTo(AlertState.INACTIVE);
        assertThat(result.getCurrentState()).isEqualTo(AlertState.PENDING);
        assertThat(result.getHistory()).isEmpty();
        assertThat(machine.size()).isEqualTo(1);
    }

    @Test
    void continuingMatchKeepsActiveAtAndRefreshesValue() {
        machine.apply(matched(T0, 3, "checkout"), T0);
        machine.apply(matched(T0.plusSeconds(60), 5, "checkout"), T0.plusSeconds(60));

        Alert alert = machine.snapshot().get(0);
        assertThat(alert.getActiveAt()).isEqualTo(T0);
        assertThat(alert.getValue()).isEqualTo(5.0);
        assertThat(alert.getState()).isEqualTo(AlertState.PENDING);
    }

    @Test
    void firesAtHoldBoundary() {
        machine.apply(matched(T0, 3, "checkout"), T0);
        Instant almost = T0.plus(Duration.ofMinutes(2)).minusMillis(1);
        assertThat(machine.apply(matched(almost, 3, "checkout"), almost).getCurrentState())
                .isEqualTo(AlertState.PENDING);

        Instant boundary = T0.plus(Duration.ofMinutes(2));
        TransitionResult result = machine.apply(matched(boundary, 4, "checkout"), boundary);

        assertThat(result.getCurrentState()).isEqualTo(AlertState.FIRING);
        assertThat(result.isOverallStateChanged()).isTrue();
        assertThat(result.getHistory()).singleElement().satisfies(record -> {
            assertThat(record.getRuleId()).isEqualTo("rule-1");
            assertThat(record.getRuleName()).isEqualTo("Checkout latency");
            assertThat(record.getState()).isEqualTo(RuleStateHistory.STATE_FIRING);
            assertThat(record.isStateChanged()).isTrue();
            assertThat(record.getUnixMilli()).isEqualTo(boundary.toEpochMilli());
            assertThat(record.getValue()).isEqualTo(4.0);
        });
    }

    @Test
    void firingAlertResolvesWhenNoLongerMatched() {
        machine.apply(matched(T0, 3, "checkout"), T0);
        Instant fired = T0.plus(Duration.ofMinutes(2));
        machine.apply(matched(fired, 3, "checkout"), fired);

        Instant resolved = fired.plusSeconds(60);
        TransitionResult result = machine.apply(Map.of(), resolved);

        assertThat(result.getCurrentState()).isEqualTo(AlertState.INACTIVE);
        assertThat(result.getHistory()).singleElement().satisfies(record -> {
            assertThat(record.getState()).isEqualTo(RuleStateHistory.STATE_NORMAL);
            assertThat(record.getOverallState()).isEqualTo(RuleStateHistory.STATE_NORMAL);
            assertThat(record.isOverallStateChanged()).isTrue();
        });
        assertThat(machine.snapshot()).singleElement()
                .satisfies(alert -> assertThat(alert.getResolvedAt()).isEqualTo(resolved));
        assertThat(machine.unresolvedSnapshot()).isEmpty();
    }

    @Test
    void resolvedAlertIsReplacedWhenSeriesMatchesAgain() {
        machine.apply(matched(T0, 3, "checkout"), T0);
        Instant fired = T0.plus(Duration.ofMinutes(2));
        machine.apply(matched(fired, 3, "checkout"), fired);
        machine.apply(Map.of(), fired.plusSeconds(60));

        Instant again = fired.plusSeconds(120);
        machine.apply(matched(again, 3, "checkout"), again);

        Alert alert = machine.snapshot().get(0);
        assertThat(alert.getState()).isEqualTo(AlertState.PENDING);
        assertThat(alert.getActiveAt()).isEqualTo(again);
        assertThat(alert.getResolvedAt()).isNull();
    }

    @Test
    void aggregateStateIsMostSevereAlert() {
        machine.apply(matched(T0, 3, "checkout"), T0);
        Instant later = T0.plus(Duration.ofMinutes(2));
        Map<Long, Alert> both = matched(later, 3, "checkout");
        both.putAll(matched(later, 3, "cart"));

        TransitionResult result = machine.apply(both, later);

        assertThat(result.getCurrentState()).isEqualTo(AlertState.FIRING);
        assertThat(machine.count(alert -> alert.getState() == AlertState.PENDING)).isEqualTo(1);
        assertThat(machine.count(alert -> alert.getState() == AlertState.FIRING)).isEqualTo(1);
    }

    @Test
    void snapshotsAreCopies() {
        machine.apply(matched(T0, 3, "checkout"), T0);

        machine.snapshot().get(0).setValue(99);

        assertThat(machine.snapshot().get(0).getValue()).isEqualTo(3.0);
    }
}
