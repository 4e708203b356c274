package com.netflexity.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Set;

/**
 * Aggregation temporality of a metric.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public enum Temporality {
    DELTA("Delta"),
    CUMULATIVE("Cumulative"),
    UNSPECIFIED("Unspecified");

    private final String value;

    Temporality(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Temporality fromValue(String value) {
        for (Temporality temporality : values()) {
            if (temporality.value.equalsIgnoreCase(value) || temporality.name().equalsIgnoreCase(value)) {
                return temporality;
            }
        }
        return UNSPECIFIED;
    }

    /**
     * Pick the temporality to query with when a metric is reported with several.
     * Delta wins over cumulative.
     */
    public static Temporality preferred(Set<Temporality> available) {
        if (available == null || available.isEmpty()) {
            return UNSPECIFIED;
        }
        if (available.contains(DELTA)) {
            return DELTA;
        }
        if (available.contains(CUMULATIVE)) {
            return CUMULATIVE;
        }
        return UNSPECIFIED;
    }
}
