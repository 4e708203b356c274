package com.netflexity.anomaly.rule;

import com.netflexity.anomaly.history.RuleStateHistory;
import lombok.Value;

import java.util.List;

/**
 * What one pass of the alert state machine changed.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Value
public class TransitionResult {

    AlertState previousState;

    AlertState currentState;

    List<RuleStateHistory> history;

    public boolean isOverallStateChanged() {
        return previousState != currentState;
    }
}
