package com.netflexity.anomaly.notification;

import com.netflexity.anomaly.rule.Alert;
import com.netflexity.anomaly.rule.AlertState;
import com.netflexity.anomaly.rule.Labels;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AlertNotificationTest {

    private static final Instant FIRED = Instant.parse("2024-05-10T12:00:00Z");

    private static Alert alert(AlertState state) {
        Alert alert = new Alert();
        alert.setState(state);
        alert.setLabels(Labels.builder()
                .set(Labels.ALERT_NAME, "Checkout latency")
                .set(Labels.RULE_ID, "rule-1")
                .set("severity", "critical")
                .set("service", "checkout")
                .build());
        alert.setAnnotations(Labels.fromMap(Map.of("summary", "score 3 for checkout")));
        alert.setValue(3.0);
        alert.setActiveAt(FIRED.minusSeconds(300));
        alert.setFiredAt(FIRED);
        alert.setValidUntil(FIRED.plusSeconds(1200));
        alert.setReceivers(new ArrayList<>(List.of("slack-ops")));
        return alert;
    }

    @Test
    void firingAlertMapsToFiringNotification() {
        Alert alert = alert(AlertState.FIRING);

        AlertNotification notification = AlertNotification.fromAlert(alert);

        assertThat(notification.getStatus()).isEqualTo(AlertNotification.STATUS_FIRING);
        assertThat(notification.getRuleId()).isEqualTo("rule-1");
        assertThat(notification.getSeverity()).isEqualTo("critical");
        assertThat(notification.getStartsAt()).isEqualTo(FIRED);
        assertThat(notification.getEndsAt()).isEqualTo(FIRED.plusSeconds(1200));
        assertThat(notification.getFingerprint()).isEqualTo(Long.toHexString(alert.getLabels().hash()));
        assertThat(notification.getReceivers()).containsExactly("slack-ops");
        assertThat(notification.getAlertTitle()).isEqualTo("[FIRING] Checkout latency");
        assertThat(notification.getStatusColor()).isEqualTo("#ff0000");
        assertThat(notification.getAlertSummary()).isEqualTo("score 3 for checkout");
    }

    @Test
    void resolvedAlertMapsToResolvedNotification() {
        Alert alert = alert(AlertState.INACTIVE);
        alert.setResolvedAt(FIRED.plusSeconds(600));

        AlertNotification notification = AlertNotification.fromAlert(alert);

        assertThat(notification.isResolved()).isTrue();
        assertThat(notification.getEndsAt()).isEqualTo(FIRED.plusSeconds(600));
        assertThat(notification.getStatusColor()).isEqualTo("#36a64f");
    }

    @Test
    void summaryFallsBackToGeneratedLine() {
        Alert alert = alert(AlertState.FIRING);
        alert.setAnnotations(Labels.empty());
        alert.setLabels(alert.getLabels().toBuilder().del("severity").build());

        AlertNotification notification = AlertNotification.fromAlert(alert);

        assertThat(notification.getSeverity()).isEqualTo("warning");
        assertThat(notification.getAlertSummary()).isEqualTo("Checkout latency anomaly score 3");
    }
}
