package com.netflexity.anomaly.config;

import com.netflexity.anomaly.rule.RuleDefinition;
import com.netflexity.anomaly.rule.RuleOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the rule engine.
 *
 * Configures rule definitions, notification channels, and
 * evaluation settings.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Configuration
@ConfigurationProperties(prefix = "anomaly.rules")
@Data
@Validated
public class RuleConfig {

    /**
     * Whether rule evaluation is enabled
     */
    private boolean enabled = false;

    /**
     * Scheduler tick in seconds. Rules are evaluated at their own frequency, rounded up to a tick.
     */
    @Min(10)
    private int evaluationIntervalSeconds = 60;

    /**
     * Minimum time between two notifications of an unchanged alert, in seconds
     */
    @Min(0)
    private int resendDelaySeconds = 300;

    /**
     * Shift of every evaluation window into the past, in seconds
     */
    @Min(0)
    private int evalDelaySeconds = 0;

    /**
     * Deadline of one rule evaluation, in seconds
     */
    @Min(1)
    private int evaluationTimeoutSeconds = 60;

    /**
     * Number of rules evaluated in parallel
     */
    @Min(1)
    private int workerThreads = 4;

    /**
     * Ignore the resend delay when sending
     */
    private boolean sendAlways = false;

    /**
     * Report observed scores even when no series matched
     */
    private boolean sendUnmatched = false;

    /**
     * Default settings for rules
     */
    @Valid
    @NotNull
    private Defaults defaults = new Defaults();

    /**
     * Rule definitions
     */
    @Valid
    private List<RuleDefinition> definitions = List.of();

    /**
     * Notification configuration
     */
    @Valid
    @NotNull
    private Notifications notifications = new Notifications();

    @Data
    public static class Defaults {
        /**
         * Default evaluation window
         */
        private Duration evalWindow = Duration.ofMinutes(5);

        /**
         * Default hold duration before an alert fires
         */
        private Duration holdDuration = Duration.ZERO;

        /**
         * Default evaluation frequency
         */
        private Duration frequency = Duration.ofMinutes(1);
    }

    @Data
    public static class Notifications {
        /**
         * Notification channel configurations
         */
        @Valid
        private List<ChannelConfig> channels = List.of();
    }

    @Data
    public static class ChannelConfig {
        /**
         * Channel name (unique identifier)
         */
        @NotEmpty
        private String name;

        /**
         * Channel type (slack, pagerduty, webhook)
         */
        @NotEmpty
        private String type;

        /**
         * Webhook URL (for slack and webhook types)
         */
        private String webhookUrl;

        /**
         * PagerDuty routing key
         */
        private String routingKey;

        /**
         * Webhook URL (alternative name for consistency)
         */
        private String url;

        /**
         * Custom headers for webhook channels
         */
        private Map<String, String> headers;

        /**
         * Whether this channel is enabled
         */
        private boolean enabled = true;
    }

    /**
     * Apply default values to rule definitions
     */
    public void applyDefaults() {
        if (definitions != null) {
            definitions.forEach(rule -> {
                if (rule.getEvalWindow() == null || rule.getEvalWindow().isZero()) {
                    rule.setEvalWindow(defaults.getEvalWindow());
                }
                if (rule.getHoldDuration() == null) {
                    rule.setHoldDuration(defaults.getHoldDuration());
                }
                if (rule.getFrequency() == null || rule.getFrequency().isZero()) {
                    rule.setFrequency(defaults.getFrequency());
                }
            });
        }
    }

    /**
     * Get enabled rule definitions
     */
    public List<RuleDefinition> getEnabledDefinitions() {
        if (definitions == null) {
            return List.of();
        }
        return definitions.stream()
                .filter(rule -> !rule.isDisabled())
                .toList();
    }

    /**
     * Get enabled notification channels
     */
    public List<ChannelConfig> getEnabledChannels() {
        if (notifications == null || notifications.getChannels() == null) {
            return List.of();
        }
        return notifications.getChannels().stream()
                .filter(ChannelConfig::isEnabled)
                .toList();
    }

    /**
     * Evaluation options shared by all configured rules
     */
    public RuleOptions toRuleOptions() {
        return RuleOptions.builder()
                .evalDelay(Duration.ofSeconds(evalDelaySeconds))
                .sendAlways(sendAlways)
                .sendUnmatched(sendUnmatched)
                .build();
    }

    public Duration getResendDelay() {
        return Duration.ofSeconds(resendDelaySeconds);
    }

    public Duration getEvaluationTimeout() {
        return Duration.ofSeconds(evaluationTimeoutSeconds);
    }
}
