package com.netflexity.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single where-clause item of a builder query.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FilterItem {

    public static final String OP_EQUAL = "=";

    private AttributeKey key;

    private String op;

    private Object value;

    public static FilterItem equal(AttributeKey key, String value) {
        return new FilterItem(key, OP_EQUAL, value);
    }

    public FilterItem copy() {
        return new FilterItem(key != null ? key.copy() : null, op, value);
    }
}
