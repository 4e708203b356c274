package com.netflexity.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of query carried by a {@link CompositeQuery}.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public enum QueryType {
    BUILDER("builder"),
    CLICKHOUSE_SQL("clickhouse_sql"),
    PROMQL("promql"),
    UNKNOWN("unknown");

    private final String value;

    QueryType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static QueryType fromValue(String value) {
        for (QueryType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
