package com.netflexity.anomaly.notification;

import com.netflexity.anomaly.rule.Alert;
import com.netflexity.anomaly.rule.AlertState;
import com.netflexity.anomaly.rule.Labels;
import com.netflexity.anomaly.template.TemplateData;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Alert payload for rule notifications.
 *
 * Contains all information needed to send notifications through
 * channels like Slack, PagerDuty or plain webhooks.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@Builder
public class AlertNotification {

    public static final String STATUS_FIRING = "firing";
    public static final String STATUS_RESOLVED = "resolved";

    /**
     * Rule that raised the alert
     */
    private String ruleId;

    /**
     * Alert name, prefixed for no-data alerts
     */
    private String alertName;

    /**
     * firing or resolved
     */
    private String status;

    /**
     * Raised because the rule's query stopped returning data
     */
    private boolean missing;

    /**
     * Severity taken from the severity label, warning when absent
     */
    @Builder.Default
    private String severity = "warning";

    /**
     * Identity labels of the alert
     */
    private Map<String, String> labels;

    private Map<String, String> annotations;

    /**
     * Anomaly score at the last match
     */
    private double value;

    /**
     * Link back to the rule
     */
    private String generatorUrl;

    /**
     * Hex fingerprint of the alert labels, stable across notifications
     */
    private String fingerprint;

    private Instant startsAt;

    /**
     * Resolution time, or the end of validity for firing alerts
     */
    private Instant endsAt;

    /**
     * Channel names the alert is routed to, every channel when empty
     */
    @Builder.Default
    private List<String> receivers = List.of();

    public boolean isResolved() {
        return STATUS_RESOLVED.equals(status);
    }

    /**
     * Get alert color based on status and severity (for notification formatting)
     */
    public String getStatusColor() {
        if (isResolved()) {
            return "#36a64f";
        }
        if (missing) {
            return "#ff9500";
        }
        return switch (severity.toLowerCase()) {
            case "critical", "error" -> "#ff0000";
            case "info" -> "#439fe0";
            default -> "#ff9500";
        };
    }

    /**
     * Get alert title for notifications
     */
    public String getAlertTitle() {
        return String.format("[%s] %s", status.toUpperCase(), alertName);
    }

    /**
     * Summary annotation, else description, else a generated line
     */
    public String getAlertSummary() {
        if (annotations != null) {
            String summary = annotations.get("summary");
            if (summary != null && !summary.isBlank()) {
                return summary;
            }
            String description = annotations.get("description");
            if (description != null && !description.isBlank()) {
                return description;
            }
        }
        if (missing) {
            return String.format("No data received for rule %s", alertName);
        }
        return String.format("%s anomaly score %s", alertName, TemplateData.format(value));
    }

    /**
     * Create a notification from an alert snapshot
     */
    public static AlertNotification fromAlert(Alert alert) {
        boolean resolved = alert.getState() == AlertState.INACTIVE && alert.isResolved();
        Labels labels = alert.getLabels();
        String severity = labels.get("severity");
        return AlertNotification.builder()
                .ruleId(labels.get(Labels.RULE_ID))
                .alertName(labels.get(Labels.ALERT_NAME))
                .status(resolved ? STATUS_RESOLVED : STATUS_FIRING)
                .missing(alert.isMissing())
                .severity(severity != null ? severity : "warning")
                .labels(labels.toMap())
                .annotations(alert.getAnnotations().toMap())
                .value(alert.getValue())
                .generatorUrl(alert.getGeneratorUrl())
                .fingerprint(Long.toHexString(labels.hash()))
                .startsAt(alert.getFiredAt() != null ? alert.getFiredAt() : alert.getActiveAt())
                .endsAt(resolved ? alert.getResolvedAt() : alert.getValidUntil())
                .receivers(alert.getReceivers() != null ? List.copyOf(alert.getReceivers()) : List.of())
                .build();
    }
}
