package com.netflexity.anomaly.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * PagerDuty notification channel implementation.
 *
 * Sends trigger events for firing alerts and resolve events for resolved
 * alerts through the Events API v2. The alert fingerprint is the dedup key,
 * so a resolve closes the incident its trigger opened.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Slf4j
public class PagerDutyNotificationChannel implements NotificationChannel {

    static final String PAGERDUTY_EVENTS_URL = "https://events.pagerduty.com/v2/enqueue";

    private final String name;
    private final String routingKey;
    private final String eventsUrl;
    private final RestTemplate restTemplate;

    public PagerDutyNotificationChannel(String name, String routingKey) {
        this(name, routingKey, PAGERDUTY_EVENTS_URL, new RestTemplate());
    }

    PagerDutyNotificationChannel(String name, String routingKey, String eventsUrl, RestTemplate restTemplate) {
        this.name = name;
        this.routingKey = routingKey;
        this.eventsUrl = eventsUrl;
        this.restTemplate = restTemplate;
    }

    @Override
    public void send(AlertNotification alert) throws NotificationException {
        if (!isConfigured()) {
            throw new NotificationException("PagerDuty channel not properly configured");
        }

        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            HttpEntity<Map<String, Object>> request = new HttpEntity<>(buildPagerDutyPayload(alert), headers);
            restTemplate.postForEntity(eventsUrl, request, String.class);

            log.debug("Sent PagerDuty {} event for alert {} to channel {}",
                    alert.isResolved() ? "resolve" : "trigger", alert.getAlertName(), name);
        } catch (Exception e) {
            throw new NotificationException("Failed to send PagerDuty notification: " + e.getMessage(), e);
        }
    }

    @Override
    public String getType() {
        return "pagerduty";
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isConfigured() {
        return routingKey != null && !routingKey.trim().isEmpty();
    }

    /**
     * Build PagerDuty Events API v2 payload
     */
    Map<String, Object> buildPagerDutyPayload(AlertNotification alert) {
        Map<String, Object> event = new HashMap<>();
        event.put("routing_key", routingKey);
        event.put("event_action", alert.isResolved() ? "resolve" : "trigger");
        event.put("dedup_key", dedupKey(alert));

        // resolve events carry no payload
        if (alert.isResolved()) {
            return event;
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("summary", alert.getAlertTitle() + ": " + alert.getAlertSummary());
        payload.put("source", alert.getGeneratorUrl() != null && !alert.getGeneratorUrl().isEmpty()
                ? alert.getGeneratorUrl() : "anomaly-rule-engine");
        payload.put("severity", mapSeverity(alert.getSeverity()));
        payload.put("timestamp", (alert.getStartsAt() != null ? alert.getStartsAt() : Instant.now()).toString());
        payload.put("component", alert.getRuleId());
        payload.put("group", alert.getAlertName());
        payload.put("class", alert.isMissing() ? "no_data" : "anomaly");

        Map<String, Object> customDetails = new HashMap<>();
        customDetails.put("score", alert.getValue());
        customDetails.put("labels", alert.getLabels());
        if (alert.getAnnotations() != null) {
            customDetails.put("annotations", alert.getAnnotations());
        }
        payload.put("custom_details", customDetails);

        event.put("payload", payload);
        return event;
    }

    static String dedupKey(AlertNotification alert) {
        return "anomaly-rule-" + alert.getRuleId() + "-" + alert.getFingerprint();
    }

    /**
     * PagerDuty accepts critical, error, warning and info only
     */
    static String mapSeverity(String severity) {
        if (severity == null) {
            return "warning";
        }
        return switch (severity.toLowerCase()) {
            case "critical", "error", "info" -> severity.toLowerCase();
            default -> "warning";
        };
    }
}
