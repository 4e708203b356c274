package com.netflexity.anomaly.rule;

/**
 * Thrown when an evaluation tick is aborted. The active alert table is left
 * as it was before the tick.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public class RuleEvaluationException extends Exception {

    /**
     * Closed set of failure categories, used for health reporting and metric tags
     */
    public enum ErrorKind {
        CONFIGURATION,
        BACKEND,
        CANCELLED,
        DUPLICATE_RESULT
    }

    private final ErrorKind kind;

    public RuleEvaluationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RuleEvaluationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
