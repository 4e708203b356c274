package com.netflexity.anomaly.rule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison applied between a score and the rule target.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public enum CompareOp {
    NONE("0", ""),
    ABOVE("1", ">"),
    BELOW("2", "<"),
    EQ("3", "=="),
    NOT_EQ("4", "!=");

    private final String code;
    private final String symbol;

    CompareOp(String code, String symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Whether {@code value} satisfies this comparison against {@code target}.
     * {@link #NONE} never matches.
     */
    public boolean matches(double value, double target) {
        return switch (this) {
            case ABOVE -> value > target;
            case BELOW -> value < target;
            case EQ -> value == target;
            case NOT_EQ -> value != target;
            case NONE -> false;
        };
    }

    @JsonCreator
    public static CompareOp fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        for (CompareOp op : values()) {
            if (op.code.equals(value) || (!op.symbol.isEmpty() && op.symbol.equals(value))
                    || op.name().equalsIgnoreCase(value)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown compare operator: " + value);
    }
}
