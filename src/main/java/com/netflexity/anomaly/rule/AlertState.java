package com.netflexity.anomaly.rule;

/**
 * Lifecycle state of an alert. Declaration order is severity order.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public enum AlertState {
    INACTIVE("inactive"),
    PENDING("pending"),
    FIRING("firing"),
    DISABLED("disabled");

    private final String label;

    AlertState(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static AlertState max(AlertState a, AlertState b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    @Override
    public String toString() {
        return label;
    }
}
