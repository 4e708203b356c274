package com.netflexity.anomaly.history;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One alert state change, as stored in the rule state history.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleStateHistory {

    public static final String STATE_NORMAL = "normal";
    public static final String STATE_FIRING = "firing";
    public static final String STATE_NO_DATA = "no_data";

    private String ruleId;

    private String ruleName;

    /**
     * Aggregate rule state after the tick
     */
    private String overallState;

    /**
     * Whether the aggregate state changed during the tick
     */
    private boolean overallStateChanged;

    /**
     * State of the alert: normal, firing or no_data
     */
    private String state;

    private boolean stateChanged;

    private long unixMilli;

    /**
     * Query result labels as a JSON object
     */
    private String labels;

    /**
     * Fingerprint of the query result labels
     */
    private long fingerprint;

    private double value;
}
