package com.netflexity.anomaly.notification;

import java.time.Instant;
import java.util.Map;

/**
 * Interface for notification channels.
 *
 * Implementations handle sending alerts through different channels
 * like Slack, PagerDuty or generic webhooks.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public interface NotificationChannel {

    /**
     * Send an alert through this notification channel
     *
     * @param alert The alert to send
     * @throws NotificationException if sending fails
     */
    void send(AlertNotification alert) throws NotificationException;

    /**
     * Get the type identifier for this channel
     *
     * @return Channel type (e.g., "slack", "pagerduty", "webhook")
     */
    String getType();

    /**
     * Get the name of this channel instance
     *
     * @return Channel instance name (e.g., "slack-ops", "pagerduty-oncall")
     */
    String getName();

    /**
     * Check if this channel is properly configured and ready to send alerts
     *
     * @return true if channel is ready, false otherwise
     */
    default boolean isConfigured() {
        return true;
    }

    /**
     * Test the channel configuration by sending a test alert
     *
     * @throws NotificationException if test fails
     */
    default void test() throws NotificationException {
        AlertNotification testAlert = AlertNotification.builder()
                .ruleId("test-rule")
                .alertName("Test Alert")
                .status(AlertNotification.STATUS_FIRING)
                .severity("info")
                .labels(Map.of("alertname", "Test Alert", "ruleId", "test-rule"))
                .annotations(Map.of("summary", "This is a test alert from the anomaly rule engine"))
                .value(4.2)
                .fingerprint("0")
                .startsAt(Instant.now())
                .build();

        send(testAlert);
    }

    /**
     * Exception thrown when notification sending fails
     */
    class NotificationException extends Exception {
        public NotificationException(String message) {
            super(message);
        }

        public NotificationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
