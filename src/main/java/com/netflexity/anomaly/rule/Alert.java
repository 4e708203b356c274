package com.netflexity.anomaly.rule;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A per-series alert owned by a rule's active table.
 *
 * Instances handed out of a rule are snapshots made with {@link #copy()}.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@NoArgsConstructor
public class Alert {

    private AlertState state = AlertState.PENDING;

    /**
     * Identity labels: series labels plus rule labels and rule identifiers
     */
    private Labels labels = Labels.empty();

    private Labels annotations = Labels.empty();

    /**
     * Series labels as returned by the query, used for history fingerprints
     */
    private Labels queryResultLabels = Labels.empty();

    private String generatorUrl;

    private List<String> receivers = new ArrayList<>();

    /**
     * Score at the last evaluation that matched
     */
    private double value;

    private Instant activeAt;

    private Instant firedAt;

    private Instant resolvedAt;

    private Instant lastSentAt;

    private Instant validUntil;

    private boolean missing;

    public Alert copy() {
        Alert copy = new Alert();
        copy.setState(state);
        copy.setLabels(labels);
        copy.setAnnotations(annotations);
        copy.setQueryResultLabels(queryResultLabels);
        copy.setGeneratorUrl(generatorUrl);
        copy.setReceivers(receivers != null ? new ArrayList<>(receivers) : new ArrayList<>());
        copy.setValue(value);
        copy.setActiveAt(activeAt);
        copy.setFiredAt(firedAt);
        copy.setResolvedAt(resolvedAt);
        copy.setLastSentAt(lastSentAt);
        copy.setValidUntil(validUntil);
        copy.setMissing(missing);
        return copy;
    }

    /**
     * Whether this alert is due for (re)delivery at {@code ts}. Pending alerts
     * are never sent; resolutions are sent once; everything else waits for the
     * resend delay.
     */
    public boolean needsSending(Instant ts, Duration resendDelay) {
        if (state == AlertState.PENDING) {
            return false;
        }
        if (resolvedAt != null && (lastSentAt == null || resolvedAt.isAfter(lastSentAt))) {
            return true;
        }
        return lastSentAt == null || lastSentAt.plus(resendDelay).isBefore(ts);
    }

    public boolean isResolved() {
        return resolvedAt != null;
    }

    public String getName() {
        return labels.get(Labels.ALERT_NAME);
    }
}
