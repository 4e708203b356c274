package com.netflexity.anomaly.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netflexity.anomaly.client.QueryServiceClient;
import com.netflexity.anomaly.client.RuleHistoryClient;
import com.netflexity.anomaly.history.EvaluationRecorder;
import com.netflexity.anomaly.link.RelatedLinks;
import com.netflexity.anomaly.rule.RuleDependencies;
import com.netflexity.anomaly.rule.TemporalityCache;
import com.netflexity.anomaly.template.PlaceholderTemplateExpander;
import com.netflexity.anomaly.template.TemplateExpander;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * Configuration for the rule engine.
 *
 * This configuration provides:
 * - WebClient bean configured for query service calls
 * - Query service client used for queries, metadata and history
 * - Shared collaborators of every rule
 */
@Configuration
@Slf4j
public class EngineConfig {

    /**
     * Create a WebClient configured for calling the query service
     */
    @Bean
    public WebClient webClient(QueryServiceConfig queryServiceConfig) {
        QueryServiceConfig.Http http = queryServiceConfig.getHttp();
        log.info("Configuring WebClient with timeouts: connect={}s, read={}s",
                http.getConnectTimeoutSeconds(), http.getReadTimeoutSeconds());

        ConnectionProvider connectionProvider = ConnectionProvider.builder("anomaly-rule-engine")
                .maxConnections(http.getMaxConnections())
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .pendingAcquireTimeout(Duration.ofSeconds(30))
                .evictInBackground(Duration.ofSeconds(60))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) Duration.ofSeconds(http.getConnectTimeoutSeconds()).toMillis())
                .responseTimeout(Duration.ofSeconds(http.getReadTimeoutSeconds()));

        // range query responses over four windows can be large
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }

    @Bean
    public QueryServiceClient queryServiceClient(WebClient webClient, QueryServiceConfig queryServiceConfig) {
        return new QueryServiceClient(webClient, queryServiceConfig);
    }

    /**
     * Create and register the evaluation metrics and history writer
     */
    @Bean
    public EvaluationRecorder evaluationRecorder(QueryServiceClient queryServiceClient,
                                                 QueryServiceConfig queryServiceConfig,
                                                 MeterRegistry meterRegistry) {
        RuleHistoryClient historyClient = queryServiceConfig.isHistoryEnabled()
                ? new RuleHistoryClient(queryServiceClient, queryServiceConfig)
                : null;
        if (historyClient == null) {
            log.info("Rule state history disabled");
        }
        return new EvaluationRecorder(historyClient, meterRegistry,
                Duration.ofSeconds(queryServiceConfig.getHttp().getReadTimeoutSeconds()));
    }

    @Bean
    public TemporalityCache temporalityCache() {
        return new TemporalityCache();
    }

    @Bean
    public TemplateExpander templateExpander() {
        return new PlaceholderTemplateExpander();
    }

    @Bean
    public RelatedLinks relatedLinks(ObjectMapper objectMapper) {
        return RelatedLinks.defaults(objectMapper);
    }

    /**
     * Collaborators shared by all configured rules
     */
    @Bean
    public RuleDependencies ruleDependencies(QueryServiceClient queryServiceClient,
                                             TemporalityCache temporalityCache,
                                             TemplateExpander templateExpander,
                                             RelatedLinks relatedLinks,
                                             EvaluationRecorder evaluationRecorder,
                                             ObjectMapper objectMapper) {
        return RuleDependencies.builder()
                .querier(queryServiceClient)
                .metadataSource(queryServiceClient)
                .temporalityCache(temporalityCache)
                .templateExpander(templateExpander)
                .relatedLinks(relatedLinks)
                .recorder(evaluationRecorder)
                .objectMapper(objectMapper)
                .build();
    }
}
