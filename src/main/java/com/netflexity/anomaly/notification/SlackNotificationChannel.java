package com.netflexity.anomaly.notification;

import com.netflexity.anomaly.template.TemplateData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Slack notification channel implementation.
 *
 * Sends alerts to Slack using incoming webhooks with one attachment per
 * alert, colored by status and severity.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Slf4j
public class SlackNotificationChannel implements NotificationChannel {

    private final String name;
    private final String webhookUrl;
    private final RestTemplate restTemplate;

    public SlackNotificationChannel(String name, String webhookUrl) {
        this(name, webhookUrl, new RestTemplate());
    }

    SlackNotificationChannel(String name, String webhookUrl, RestTemplate restTemplate) {
        this.name = name;
        this.webhookUrl = webhookUrl;
        this.restTemplate = restTemplate;
    }

    @Override
    public void send(AlertNotification alert) throws NotificationException {
        if (!isConfigured()) {
            throw new NotificationException("Slack channel not properly configured");
        }

        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            HttpEntity<Map<String, Object>> request = new HttpEntity<>(buildSlackPayload(alert), headers);
            restTemplate.postForEntity(webhookUrl, request, String.class);

            log.debug("Sent Slack notification for alert {} to channel {}", alert.getAlertName(), name);
        } catch (Exception e) {
            throw new NotificationException("Failed to send Slack notification: " + e.getMessage(), e);
        }
    }

    @Override
    public String getType() {
        return "slack";
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isConfigured() {
        return webhookUrl != null && !webhookUrl.trim().isEmpty();
    }

    /**
     * Build Slack webhook payload with rich formatting
     */
    Map<String, Object> buildSlackPayload(AlertNotification alert) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("text", alert.getAlertTitle());

        Map<String, Object> attachment = new HashMap<>();
        attachment.put("color", alert.getStatusColor());
        attachment.put("title", alert.getAlertName());
        if (alert.getGeneratorUrl() != null && !alert.getGeneratorUrl().isEmpty()) {
            attachment.put("title_link", alert.getGeneratorUrl());
        }
        attachment.put("text", alert.getAlertSummary());

        List<Map<String, Object>> fields = new ArrayList<>();
        fields.add(createField("Rule", alert.getRuleId(), true));
        fields.add(createField("Severity", alert.getSeverity(), true));
        fields.add(createField("Score", TemplateData.format(alert.getValue()), true));
        if (alert.getStartsAt() != null) {
            fields.add(createField("Active Since", alert.getStartsAt().toString(), true));
        }
        if (alert.isResolved() && alert.getEndsAt() != null) {
            fields.add(createField("Resolved At", alert.getEndsAt().toString(), true));
        }
        attachment.put("fields", fields);

        attachment.put("footer", "Anomaly Rule Engine");
        attachment.put("ts", System.currentTimeMillis() / 1000);

        payload.put("attachments", List.of(attachment));
        return payload;
    }

    private Map<String, Object> createField(String title, String value, boolean isShort) {
        Map<String, Object> field = new HashMap<>();
        field.put("title", title);
        field.put("value", value != null ? value : "");
        field.put("short", isShort);
        return field;
    }
}
