package com.netflexity.anomaly.rule;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Per-rule evaluation switches.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@Builder
public class RuleOptions {

    /**
     * Shift of the evaluation window into the past, for late-arriving data
     */
    @Builder.Default
    private Duration evalDelay = Duration.ZERO;

    /**
     * Report the newest observed score even when nothing matched
     */
    private boolean sendUnmatched;

    /**
     * Ignore the resend delay when sending
     */
    private boolean sendAlways;

    public static RuleOptions defaults() {
        return RuleOptions.builder().build();
    }
}
