package com.netflexity.anomaly.rule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netflexity.anomaly.history.RuleStateHistory;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Active alert table of one rule and the transitions applied to it each tick.
 *
 * Not thread-safe: the owning rule serializes access with its state lock.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Slf4j
public class AlertStateMachine {

    /**
     * How long a resolved alert is kept so that its resolution can be delivered
     */
    public static final Duration RESOLVED_RETENTION = Duration.ofMinutes(15);

    private final String ruleId;
    private final String ruleName;
    private final Duration holdDuration;
    private final ObjectMapper objectMapper;
    private final Map<Long, Alert> active = new LinkedHashMap<>();

    public AlertStateMachine(String ruleId, String ruleName, Duration holdDuration, ObjectMapper objectMapper) {
        this.ruleId = ruleId;
        this.ruleName = ruleName;
        this.holdDuration = holdDuration == null ? Duration.ZERO : holdDuration;
        this.objectMapper = objectMapper;
    }

    /**
     * Apply the alerts matched at {@code ts} to the table.
     *
     * @param matched fingerprint to freshly built pending alert, one per matched series
     * @param ts      evaluation timestamp
     * @return state change records of this tick and the aggregate state before and after
     */
    public TransitionResult apply(Map<Long, Alert> matched, Instant ts) {
        AlertState previous = aggregateState();
        List<RuleStateHistory> history = new ArrayList<>();

        for (Map.Entry<Long, Alert> entry : matched.entrySet()) {
            Alert existing = active.get(entry.getKey());
            if (existing != null && existing.getState() != AlertState.INACTIVE) {
                existing.setValue(entry.getValue().getValue());
                existing.setAnnotations(entry.getValue().getAnnotations());
                existing.setReceivers(new ArrayList<>(entry.getValue().getReceivers()));
                continue;
            }
            active.put(entry.getKey(), entry.getValue());
        }

        Iterator<Map.Entry<Long, Alert>> it = active.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Long, Alert> entry = it.next();
            Alert alert = entry.getValue();

            if (!matched.containsKey(entry.getKey())) {
                if (alert.getState() == AlertState.PENDING) {
                    it.remove();
                    continue;
                }
                if (alert.getResolvedAt() != null
                        && Duration.between(alert.getResolvedAt(), ts).compareTo(RESOLVED_RETENTION) > 0) {
                    it.remove();
                    continue;
                }
                if (alert.getState() != AlertState.INACTIVE) {
                    alert.setState(AlertState.INACTIVE);
                    alert.setResolvedAt(ts);
                    history.add(record(alert, RuleStateHistory.STATE_NORMAL, ts));
                }
                continue;
            }

            if (alert.getState() == AlertState.PENDING
                    && Duration.between(alert.getActiveAt(), ts).compareTo(holdDuration) >= 0) {
                alert.setState(AlertState.FIRING);
                alert.setFiredAt(ts);
                String state = alert.isMissing() ? RuleStateHistory.STATE_NO_DATA : RuleStateHistory.STATE_FIRING;
                history.add(record(alert, state, ts));
            }
        }

        AlertState current = aggregateState();
        boolean changed = current != previous;
        String overall = current == AlertState.INACTIVE && changed
                ? RuleStateHistory.STATE_NORMAL : current.getLabel();
        history.forEach(item -> {
            item.setOverallState(overall);
            item.setOverallStateChanged(changed);
        });

        log.debug("Rule {} transitions at {}: {} alerts tracked, state {} -> {}, {} history records",
                ruleId, ts, active.size(), previous, current, history.size());
        return new TransitionResult(previous, current, history);
    }

    /**
     * Most severe state in the table, inactive when empty
     */
    public AlertState aggregateState() {
        AlertState max = AlertState.INACTIVE;
        for (Alert alert : active.values()) {
            max = AlertState.max(max, alert.getState());
        }
        return max;
    }

    /**
     * Copies of every tracked alert
     */
    public List<Alert> snapshot() {
        return active.values().stream().map(Alert::copy).toList();
    }

    /**
     * Copies of tracked alerts that are not resolved
     */
    public List<Alert> unresolvedSnapshot() {
        return active.values().stream()
                .filter(alert -> !alert.isResolved())
                .map(Alert::copy)
                .toList();
    }

    public void forEach(Consumer<Alert> action) {
        active.values().forEach(action);
    }

    public int size() {
        return active.size();
    }

    public long count(Predicate<Alert> filter) {
        return active.values().stream().filter(filter).count();
    }

    private RuleStateHistory record(Alert alert, String state, Instant ts) {
        return RuleStateHistory.builder()
                .ruleId(ruleId)
                .ruleName(ruleName)
                .state(state)
                .stateChanged(true)
                .unixMilli(ts.toEpochMilli())
                .labels(labelsJson(alert))
                .fingerprint(alert.getQueryResultLabels().hash())
                .value(alert.getValue())
                .build();
    }

    private String labelsJson(Alert alert) {
        try {
            return objectMapper.writeValueAsString(alert.getQueryResultLabels().toMap());
        } catch (JsonProcessingException e) {
            log.error("Error marshaling labels {} of rule {}: {}", alert.getQueryResultLabels(), ruleId, e.getMessage());
            return "{}";
        }
    }
}
