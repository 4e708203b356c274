package com.netflexity.anomaly.rule;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of the most recent evaluation of a rule.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public enum RuleHealth {
    UNKNOWN("unknown"),
    GOOD("ok"),
    BAD("err");

    private final String value;

    RuleHealth(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
