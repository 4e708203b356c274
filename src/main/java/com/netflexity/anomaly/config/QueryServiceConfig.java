package com.netflexity.anomaly.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings of the query service that executes range queries,
 * serves metric metadata and stores rule state history.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Configuration
@ConfigurationProperties(prefix = "anomaly.query-service")
@Data
@Validated
public class QueryServiceConfig {

    /**
     * Base URL of the query service
     */
    @NotEmpty
    private String baseUrl = "http://localhost:8080";

    /**
     * API key sent as a bearer token, optional
     */
    private String apiKey;

    /**
     * Whether state history is written back to the query service
     */
    private boolean historyEnabled = true;

    /**
     * HTTP client configuration
     */
    @Valid
    @NotNull
    private Http http = new Http();

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.trim().isEmpty();
    }

    @Data
    public static class Http {
        /**
         * Connection timeout in seconds
         */
        @Min(1)
        private int connectTimeoutSeconds = 10;

        /**
         * Read timeout in seconds
         */
        @Min(1)
        private int readTimeoutSeconds = 30;

        /**
         * Maximum number of retries for failed requests
         */
        @Min(0)
        private int maxRetries = 2;

        /**
         * Maximum number of pooled connections
         */
        @Min(1)
        private int maxConnections = 50;
    }
}
