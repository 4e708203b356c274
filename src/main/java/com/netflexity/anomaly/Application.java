package com.netflexity.anomaly;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Anomaly Rule Engine.
 *
 * This Spring Boot application evaluates seasonal anomaly alert rules
 * against a query service and notifies configured channels.
 *
 * Features:
 * - Scheduled rule evaluation with hold durations and resend delays
 * - Slack, PagerDuty and webhook notifications
 * - Prometheus metrics at /actuator/prometheus
 * - Health checks at /actuator/health
 * - Rule status API under /api/rules
 *
 * @author Netflexity
 * @version 1.0.0
 */
@SpringBootApplication
@EnableScheduling
@Slf4j
public class Application {

    public static void main(String[] args) {
        log.info("Starting Anomaly Rule Engine...");
        SpringApplication.run(Application.class, args);
        log.info("Anomaly Rule Engine started successfully!");
    }
}
