package com.netflexity.anomaly.notification;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpEntity;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SlackNotificationChannelTest {

    private final RestTemplate restTemplate = mock(RestTemplate.class);

    private static AlertNotification alert() {
        return AlertNotification.builder()
                .ruleId("rule-1")
                .alertName("Checkout latency")
                .status(AlertNotification.STATUS_RESOLVED)
                .labels(Map.of("service", "checkout"))
                .annotations(Map.of())
                .value(2.5)
                .generatorUrl("https://obs.example.com/alerts/edit?ruleId=rule-1")
                .startsAt(Instant.parse("2024-05-10T12:00:00Z"))
                .endsAt(Instant.parse("2024-05-10T12:10:00Z"))
                .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void payloadHasOneColoredAttachment() {
        SlackNotificationChannel channel =
                new SlackNotificationChannel("slack-ops", "https://hooks.slack.test/T000", restTemplate);

        Map<String, Object> payload = channel.buildSlackPayload(alert());

        assertThat(payload).containsEntry("text", "[RESOLVED] Checkout latency");
        List<Map<String, Object>> attachments = (List<Map<String, Object>>) payload.get("attachments");
        assertThat(attachments).singleElement().satisfies(attachment -> {
            assertThat(attachment)
                    .containsEntry("color", "#36a64f")
                    .containsEntry("title_link", "https://obs.example.com/alerts/edit?ruleId=rule-1")
                    .containsEntry("text", "Checkout latency anomaly score 2.5");
            List<Map<String, Object>> fields = (List<Map<String, Object>>) attachment.get("fields");
            assertThat(fields).extracting(field -> field.get("title"))
                    .containsExactly("Rule", "Severity", "Score", "Active Since", "Resolved At");
        });
    }

    @Test
    void sendPostsJsonToWebhook() throws Exception {
        SlackNotificationChannel channel =
                new SlackNotificationChannel("slack-ops", "https://hooks.slack.test/T000", restTemplate);

        channel.send(alert());

        verify(restTemplate).postForEntity(eq("https://hooks.slack.test/T000"),
                argThat(
                        (HttpEntity<?> request) -> MediaType.APPLICATION_JSON.equals(request.getHeaders().getContentType())),
                eq(String.class));
    }

    @Test
    void blankWebhookIsNotConfigured() {
        assertThat(new SlackNotificationChannel("slack-ops", "", restTemplate).isConfigured()).isFalse();
        assertThat(new SlackNotificationChannel("slack-ops", null, restTemplate).isConfigured()).isFalse();
    }
}
