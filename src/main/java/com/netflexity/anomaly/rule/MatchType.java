package com.netflexity.anomaly.rule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the per-point scores of a series are reduced to one alert decision.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public enum MatchType {
    NONE("0"),
    AT_LEAST_ONCE("1"),
    ALL_THE_TIMES("2"),
    ON_AVERAGE("3"),
    IN_TOTAL("4");

    private final String code;

    MatchType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static MatchType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        for (MatchType type : values()) {
            if (type.code.equals(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown match type: " + value);
    }
}
