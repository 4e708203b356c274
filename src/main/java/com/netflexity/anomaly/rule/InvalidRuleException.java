package com.netflexity.anomaly.rule;

/**
 * Thrown when a rule definition cannot be turned into an evaluable rule.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public class InvalidRuleException extends Exception {

    public InvalidRuleException(String message) {
        super(message);
    }

    public InvalidRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
