package com.netflexity.anomaly.rule;

/**
 * Signal an alert rule is defined over. Decides which related-data link
 * an alert carries.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public enum AlertType {
    METRIC_BASED_ALERT,
    LOGS_BASED_ALERT,
    TRACES_BASED_ALERT,
    EXCEPTIONS_BASED_ALERT
}
