package com.netflexity.anomaly.rule;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stored definition of an anomaly alert rule.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
public class RuleDefinition {

    /**
     * Unique rule identifier
     */
    @NotEmpty
    private String id;

    /**
     * Alert name, used as the alertname label
     */
    @NotEmpty
    private String alertName;

    /**
     * Signal the rule watches
     */
    private AlertType alertType = AlertType.METRIC_BASED_ALERT;

    /**
     * URL of the page the rule was created from
     */
    private String source;

    /**
     * Length of the evaluated window. Five minutes when unset.
     */
    private Duration evalWindow;

    /**
     * How often the rule is evaluated. Every minute when unset.
     */
    private Duration frequency;

    /**
     * How long a condition must hold before an alert fires. Fires immediately when unset.
     */
    private Duration holdDuration;

    private Map<String, String> labels = new LinkedHashMap<>();

    private Map<String, String> annotations = new LinkedHashMap<>();

    /**
     * Notification channels alerts of this rule are routed to
     */
    private List<String> preferredChannels = new ArrayList<>();

    @NotNull
    @Valid
    private RuleCondition condition;

    private boolean disabled;
}
