package com.netflexity.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Telemetry signal a builder query reads from.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public enum DataSource {
    METRICS("metrics"),
    LOGS("logs"),
    TRACES("traces");

    private final String value;

    DataSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DataSource fromValue(String value) {
        for (DataSource source : values()) {
            if (source.value.equalsIgnoreCase(value) || source.name().equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown data source: " + value);
    }
}
