package com.netflexity.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Result shape requested from the query backend.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public enum PanelType {
    GRAPH("graph"),
    VALUE("value"),
    TABLE("table"),
    LIST("list"),
    TRACE("trace");

    private final String value;

    PanelType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PanelType fromValue(String value) {
        for (PanelType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown panel type: " + value);
    }
}
