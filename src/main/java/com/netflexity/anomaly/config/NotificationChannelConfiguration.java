package com.netflexity.anomaly.config;

import com.netflexity.anomaly.notification.NotificationChannel;
import com.netflexity.anomaly.notification.NotificationDispatcher;
import com.netflexity.anomaly.notification.PagerDutyNotificationChannel;
import com.netflexity.anomaly.notification.SlackNotificationChannel;
import com.netflexity.anomaly.notification.WebhookNotificationChannel;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for notification channels.
 *
 * Creates notification channel instances based on application configuration
 * and the dispatcher that routes alerts to them.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Configuration
@ConditionalOnProperty(prefix = "anomaly.rules", name = "enabled", havingValue = "true")
@Slf4j
public class NotificationChannelConfiguration {

    private final RuleConfig ruleConfig;

    public NotificationChannelConfiguration(RuleConfig ruleConfig) {
        this.ruleConfig = ruleConfig;
    }

    /**
     * Create notification channel instances from configuration
     */
    @Bean
    public List<NotificationChannel> notificationChannels() {
        List<NotificationChannel> channels = new ArrayList<>();

        for (RuleConfig.ChannelConfig channelConfig : ruleConfig.getEnabledChannels()) {
            NotificationChannel channel = createChannel(channelConfig);
            if (channel != null) {
                channels.add(channel);
                log.info("Created {} notification channel: {}", channel.getType(), channel.getName());
            }
        }

        log.info("Initialized {} notification channels", channels.size());
        return channels;
    }

    @Bean
    public NotificationDispatcher notificationDispatcher(MeterRegistry meterRegistry) {
        return new NotificationDispatcher(notificationChannels(), meterRegistry);
    }

    /**
     * Create a notification channel instance based on configuration
     */
    static NotificationChannel createChannel(RuleConfig.ChannelConfig config) {
        return switch (config.getType().toLowerCase()) {
            case "slack" -> createSlackChannel(config);
            case "pagerduty" -> createPagerDutyChannel(config);
            case "webhook" -> createWebhookChannel(config);
            default -> {
                log.warn("Unknown notification channel type: {}", config.getType());
                yield null;
            }
        };
    }

    private static NotificationChannel createSlackChannel(RuleConfig.ChannelConfig config) {
        if (config.getWebhookUrl() == null || config.getWebhookUrl().trim().isEmpty()) {
            log.warn("Slack channel '{}' missing webhook URL", config.getName());
            return null;
        }
        return new SlackNotificationChannel(config.getName(), config.getWebhookUrl());
    }

    private static NotificationChannel createPagerDutyChannel(RuleConfig.ChannelConfig config) {
        if (config.getRoutingKey() == null || config.getRoutingKey().trim().isEmpty()) {
            log.warn("PagerDuty channel '{}' missing routing key", config.getName());
            return null;
        }
        return new PagerDutyNotificationChannel(config.getName(), config.getRoutingKey());
    }

    private static NotificationChannel createWebhookChannel(RuleConfig.ChannelConfig config) {
        String url = config.getUrl() != null ? config.getUrl() : config.getWebhookUrl();
        if (url == null || url.trim().isEmpty()) {
            log.warn("Webhook channel '{}' missing URL", config.getName());
            return null;
        }
        return new WebhookNotificationChannel(config.getName(), url, config.getHeaders());
    }
}
