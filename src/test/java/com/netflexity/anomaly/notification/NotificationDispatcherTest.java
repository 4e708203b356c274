package com.netflexity.anomaly.notification;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NotificationDispatcherTest {

    private SimpleMeterRegistry meterRegistry;
    private CapturingChannel slack;
    private CapturingChannel webhook;
    private CapturingChannel broken;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        slack = new CapturingChannel("slack-ops", "slack", true, false);
        webhook = new CapturingChannel("webhook-audit", "webhook", true, false);
        broken = new CapturingChannel("pagerduty-oncall", "pagerduty", true, true);
        dispatcher = new NotificationDispatcher(List.of(slack, webhook, broken), meterRegistry);
    }

    private static AlertNotification alert(List<String> receivers) {
        return AlertNotification.builder()
                .ruleId("rule-1")
                .alertName("Checkout latency")
                .status(AlertNotification.STATUS_FIRING)
                .labels(Map.of("service", "checkout"))
                .annotations(Map.of())
                .value(3.0)
                .fingerprint("abc")
                .startsAt(Instant.parse("2024-05-10T12:00:00Z"))
                .receivers(receivers)
                .build();
    }

    @Test
    void alertWithoutReceiversGoesToEveryChannel() {
        int sent = dispatcher.dispatch(alert(List.of()));

        assertThat(sent).isEqualTo(2);
        assertThat(slack.sent).hasSize(1);
        assertThat(webhook.sent).hasSize(1);
        assertThat(meterRegistry.get("anomaly_notifications_failed_total")
                .tag("channel", "pagerduty-oncall")
                .tag("error", "IllegalStateException")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void receiversRestrictDelivery() {
        int sent = dispatcher.dispatch(alert(List.of("webhook-audit", "unknown")));

        assertThat(sent).isEqualTo(1);
        assertThat(slack.sent).isEmpty();
        assertThat(webhook.sent).singleElement()
                .satisfies(notification -> assertThat(notification.getRuleId()).isEqualTo("rule-1"));
        assertThat(meterRegistry.get("anomaly_notifications_total")
                .tag("rule", "rule-1")
                .tag("channel", "webhook-audit")
                .tag("status", "firing")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void unconfiguredChannelIsSkipped() {
        CapturingChannel unconfigured = new CapturingChannel("slack-dev", "slack", false, false);
        NotificationDispatcher single = new NotificationDispatcher(List.of(unconfigured), meterRegistry);

        assertThat(single.dispatch(alert(List.of()))).isZero();
        assertThat(unconfigured.sent).isEmpty();
    }

    @Test
    void noChannelsSendsNothing() {
        assertThat(new NotificationDispatcher(null, meterRegistry).dispatch(alert(List.of()))).isZero();
    }

    @Test
    void testChannelSendsSyntheticAlert() throws Exception {
        dispatcher.testChannel("slack-ops");

        assertThat(slack.sent).singleElement()
                .satisfies(notification -> assertThat(notification.getAlertName()).isEqualTo("Test Alert"));
    }

    @Test
    void testChannelRejectsUnknownChannel() {
        assertThatThrownBy(() -> dispatcher.testChannel("missing"))
                .isInstanceOf(NotificationChannel.NotificationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void channelsAreExposedByName() {
        assertThat(dispatcher.getChannels()).containsOnlyKeys("slack-ops", "webhook-audit", "pagerduty-oncall");
    }

    private static final class CapturingChannel implements NotificationChannel {

        private final String name;
        private final String type;
        private final boolean configured;
        private final boolean failing;
        private final List<AlertNotification> sent = new ArrayList<>();

        CapturingChannel(String name, String type, boolean configured, boolean failing) {
            this.name = name;
            this.type = type;
            this.configured = configured;
            this.failing = failing;
        }

        @Override
        public void send(AlertNotification alert) throws NotificationException {
            if (failing) {
                throw new NotificationException("delivery failed", new IllegalStateException("503"));
            }
            sent.add(alert);
        }

        @Override
        public String getType() {
            return type;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public boolean isConfigured() {
            return configured;
        }
    }
}
