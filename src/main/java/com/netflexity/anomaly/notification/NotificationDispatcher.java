package com.netflexity.anomaly.notification;

import com.netflexity.anomaly.rule.Alert;
import com.netflexity.anomaly.rule.NotifyFunc;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Notification dispatcher that routes alerts to configured channels.
 *
 * Alerts go to the channels named in their receivers, or to every channel
 * when they name none. A failing channel never stops delivery to the others.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Slf4j
public class NotificationDispatcher implements NotifyFunc {

    private final Map<String, NotificationChannel> channels;
    private final MeterRegistry meterRegistry;

    public NotificationDispatcher(List<NotificationChannel> channelList, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.channels = new LinkedHashMap<>();
        if (channelList != null) {
            channelList.forEach(channel -> channels.put(channel.getName(), channel));
        }

        log.info("NotificationDispatcher initialized with {} channels: {}",
                channels.size(), channels.keySet());
    }

    @Override
    public void notify(String groupKey, List<Alert> alerts) {
        for (Alert alert : alerts) {
            dispatch(AlertNotification.fromAlert(alert));
        }
    }

    /**
     * Dispatch one notification to its channels
     *
     * @return number of channels that accepted the notification
     */
    public int dispatch(AlertNotification alert) {
        Collection<String> targets = alert.getReceivers() == null || alert.getReceivers().isEmpty()
                ? new ArrayList<>(channels.keySet())
                : alert.getReceivers();

        if (targets.isEmpty()) {
            log.debug("No notification channels configured for alert: {}", alert.getAlertName());
            return 0;
        }

        int successCount = 0;
        int failureCount = 0;

        for (String channelName : targets) {
            NotificationChannel channel = channels.get(channelName);

            if (channel == null) {
                log.warn("Notification channel '{}' not found for alert '{}'", channelName, alert.getAlertName());
                failureCount++;
                continue;
            }

            if (!channel.isConfigured()) {
                log.warn("Notification channel '{}' is not properly configured", channelName);
                failureCount++;
                continue;
            }

            try {
                channel.send(alert);
                successCount++;
                sentCounter(alert, channel).increment();

                log.debug("Successfully sent {} notification for alert '{}' via channel '{}'",
                        alert.getStatus(), alert.getAlertName(), channelName);

            } catch (NotificationChannel.NotificationException e) {
                failureCount++;
                failedCounter(alert, channel, e).increment();

                log.error("Failed to send notification for alert '{}' via channel '{}': {}",
                        alert.getAlertName(), channelName, e.getMessage(), e);
            }
        }

        log.info("Notification dispatch completed for alert '{}' ({}): {} successful, {} failed",
                alert.getAlertName(), alert.getStatus(), successCount, failureCount);
        return successCount;
    }

    /**
     * Test a specific notification channel
     */
    public void testChannel(String channelName) throws NotificationChannel.NotificationException {
        NotificationChannel channel = channels.get(channelName);

        if (channel == null) {
            throw new NotificationChannel.NotificationException("Channel '" + channelName + "' not found");
        }

        if (!channel.isConfigured()) {
            throw new NotificationChannel.NotificationException("Channel '" + channelName + "' is not configured");
        }

        channel.test();
        log.info("Successfully tested notification channel: {}", channelName);
    }

    /**
     * Get available notification channels
     */
    public Map<String, NotificationChannel> getChannels() {
        return Map.copyOf(channels);
    }

    private Counter sentCounter(AlertNotification alert, NotificationChannel channel) {
        return Counter.builder("anomaly_notifications_total")
                .description("Total number of notifications sent")
                .tag("rule", nullToEmpty(alert.getRuleId()))
                .tag("channel", channel.getName())
                .tag("channel_type", channel.getType())
                .tag("status", nullToEmpty(alert.getStatus()))
                .register(meterRegistry);
    }

    private Counter failedCounter(AlertNotification alert, NotificationChannel channel, Exception error) {
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        return Counter.builder("anomaly_notifications_failed_total")
                .description("Total number of failed notifications")
                .tag("rule", nullToEmpty(alert.getRuleId()))
                .tag("channel", channel.getName())
                .tag("channel_type", channel.getType())
                .tag("error", cause.getClass().getSimpleName())
                .register(meterRegistry);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
