package com.netflexity.anomaly.rule;

import lombok.Builder;
import lombok.Data;

/**
 * One alerting observation produced by a tick, before it becomes an alert.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@Builder
public class Sample {

    /**
     * Labels forming the alert identity
     */
    @Builder.Default
    private Labels metric = Labels.empty();

    /**
     * Series labels as returned by the query
     */
    @Builder.Default
    private Labels metricOrig = Labels.empty();

    /**
     * Score that decided the match
     */
    private double value;

    /**
     * Synthetic no-data observation
     */
    private boolean missing;
}
