package com.netflexity.anomaly.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Generic webhook notification channel implementation.
 *
 * Sends alerts via HTTP POST to configurable URLs with custom
 * headers and a JSON payload modelled on alert manager webhooks.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Slf4j
public class WebhookNotificationChannel implements NotificationChannel {

    private final String name;
    private final String url;
    private final Map<String, String> headers;
    private final RestTemplate restTemplate;

    public WebhookNotificationChannel(String name, String url, Map<String, String> headers) {
        this(name, url, headers, new RestTemplate());
    }

    WebhookNotificationChannel(String name, String url, Map<String, String> headers, RestTemplate restTemplate) {
        this.name = name;
        this.url = url;
        this.headers = headers != null ? headers : new HashMap<>();
        this.restTemplate = restTemplate;
    }

    @Override
    public void send(AlertNotification alert) throws NotificationException {
        if (!isConfigured()) {
            throw new NotificationException("Webhook channel not properly configured");
        }

        try {
            HttpHeaders httpHeaders = new HttpHeaders();
            httpHeaders.setContentType(MediaType.APPLICATION_JSON);
            headers.forEach(httpHeaders::set);

            HttpEntity<Map<String, Object>> request = new HttpEntity<>(buildWebhookPayload(alert), httpHeaders);
            restTemplate.postForEntity(url, request, String.class);

            log.debug("Sent webhook notification for alert {} to URL {}", alert.getAlertName(), url);
        } catch (Exception e) {
            throw new NotificationException("Failed to send webhook notification: " + e.getMessage(), e);
        }
    }

    @Override
    public String getType() {
        return "webhook";
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isConfigured() {
        return url != null && !url.trim().isEmpty();
    }

    Map<String, Object> buildWebhookPayload(AlertNotification alert) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("source", "anomaly-rule-engine");
        payload.put("receiver", name);
        payload.put("status", alert.getStatus());

        payload.put("ruleId", alert.getRuleId());
        payload.put("alertName", alert.getAlertName());
        payload.put("severity", alert.getSeverity());
        payload.put("labels", alert.getLabels());
        payload.put("annotations", alert.getAnnotations());
        payload.put("value", alert.getValue());
        payload.put("fingerprint", alert.getFingerprint());
        payload.put("missing", alert.isMissing());
        payload.put("generatorURL", alert.getGeneratorUrl());
        payload.put("startsAt", alert.getStartsAt() != null ? alert.getStartsAt().toString() : null);
        payload.put("endsAt", alert.getEndsAt() != null ? alert.getEndsAt().toString() : null);

        payload.put("summary", alert.getAlertSummary());
        return payload;
    }
}
