package com.netflexity.anomaly.rule;

import lombok.Value;

/**
 * Outcome of scoring one series.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Value
public class ScoreDecision {

    private static final ScoreDecision UNSCORED = new ScoreDecision(false, false, Double.NaN);

    /**
     * Whether the series had usable baselines and points
     */
    boolean scored;

    boolean shouldAlert;

    /**
     * Score that decided the outcome
     */
    double value;

    public static ScoreDecision unscored() {
        return UNSCORED;
    }

    public static ScoreDecision match(double value) {
        return new ScoreDecision(true, true, value);
    }

    public static ScoreDecision noMatch(double value) {
        return new ScoreDecision(true, false, value);
    }
}
