package com.netflexity.anomaly.client;

import com.netflexity.anomaly.config.QueryServiceConfig;
import com.netflexity.anomaly.model.AttributeKey;
import com.netflexity.anomaly.model.QueryRangeParams;
import com.netflexity.anomaly.model.QueryRangeResponse;
import com.netflexity.anomaly.model.Temporality;
import com.netflexity.anomaly.rule.MetadataSource;
import com.netflexity.anomaly.rule.Querier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Client for the query service range query and metric metadata APIs.
 *
 * Provides methods to:
 * - Run composite range queries for one window
 * - Look up the temporalities metrics were reported with
 *
 * Attribute key hints are resolved by the service itself and not sent.
 */
@Slf4j
public class QueryServiceClient implements Querier, MetadataSource {

    static final String QUERY_RANGE_PATH = "/api/v4/query_range";
    static final String TEMPORALITY_PATH = "/api/v1/metrics/temporality";

    private final WebClient webClient;
    private final QueryServiceConfig config;

    public QueryServiceClient(WebClient webClient, QueryServiceConfig config) {
        this.webClient = webClient;
        this.config = config;

        log.info("Initialized QueryServiceClient for {}", config.getBaseUrl());
    }

    /**
     * Run a composite range query
     *
     * @param params query window, step and composite query
     * @param keys   attribute key hints, not forwarded
     * @return Mono containing the results per query name
     */
    @Override
    public Mono<QueryRangeResponse> queryRange(QueryRangeParams params, Map<String, AttributeKey> keys) {
        log.debug("Running range query {} - {} step {}s", params.getStart(), params.getEnd(), params.getStep());

        return post(QUERY_RANGE_PATH, params, new ParameterizedTypeReference<ApiResponse<QueryRangeResponse>>() {},
                "query range")
                .doOnSuccess(response -> log.debug("Range query returned {} results",
                        response != null && response.getResults() != null ? response.getResults().size() : 0));
    }

    /**
     * Fetch temporalities for a batch of metrics
     *
     * @param metricNames metrics to look up
     * @return Mono containing the known temporalities per metric
     */
    @Override
    public Mono<Map<String, Set<Temporality>>> fetchTemporality(List<String> metricNames) {
        if (metricNames == null || metricNames.isEmpty()) {
            return Mono.just(Map.of());
        }
        log.debug("Fetching temporality for {} metrics", metricNames.size());

        return post(TEMPORALITY_PATH, Map.of("metricNames", metricNames),
                new ParameterizedTypeReference<ApiResponse<Map<String, Set<Temporality>>>>() {},
                "fetch temporality")
                .defaultIfEmpty(Map.of());
    }

    /**
     * POST a JSON body and unwrap the response envelope
     */
    <T> Mono<T> post(String path, Object body, ParameterizedTypeReference<ApiResponse<T>> type, String operation) {
        return webClient.post()
                .uri(config.getBaseUrl() + path)
                .contentType(MediaType.APPLICATION_JSON)
                .headers(this::authorize)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> handleApiError(response, operation))
                .bodyToMono(type)
                .flatMap(envelope -> unwrap(envelope, operation))
                .retryWhen(Retry.backoff(config.getHttp().getMaxRetries(), Duration.ofSeconds(1))
                        .filter(QueryServiceClient::isRetryableError)
                        .doBeforeRetry(retrySignal -> log.warn("Retrying {}, attempt {}: {}", operation,
                                retrySignal.totalRetries() + 1, retrySignal.failure().getMessage())))
                .timeout(Duration.ofSeconds(config.getHttp().getReadTimeoutSeconds()))
                .doOnError(error -> log.error("Failed to {}: {}", operation, error.getMessage()));
    }

    void authorize(HttpHeaders headers) {
        if (config.hasApiKey()) {
            headers.setBearerAuth(config.getApiKey());
        }
    }

    private static <T> Mono<T> unwrap(ApiResponse<T> envelope, String operation) {
        if (!envelope.isSuccess()) {
            return Mono.error(new QueryServiceException(0,
                    String.format("API call failed during %s: %s", operation, envelope.getError())));
        }
        return Mono.justOrEmpty(envelope.getData());
    }

    /**
     * Wraps errors in QueryServiceException to preserve HTTP status for retry filtering.
     */
    static Mono<? extends Throwable> handleApiError(ClientResponse response, String operation) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .doOnNext(body -> log.error("API error during {}: status={}, body={}", operation, response.statusCode(), body))
                .then(Mono.error(new QueryServiceException(response.statusCode().value(),
                        String.format("API call failed during %s with status: %s", operation, response.statusCode()))));
    }

    /**
     * Client errors other than 429 and error envelopes are final, everything else is retried
     */
    static boolean isRetryableError(Throwable throwable) {
        if (throwable instanceof QueryServiceException apiEx) {
            return apiEx.isRetryable();
        }
        if (throwable instanceof WebClientResponseException wcEx) {
            HttpStatusCode status = wcEx.getStatusCode();
            return !(status.is4xxClientError() && status.value() != 429);
        }
        // Timeouts and connection issues
        return true;
    }
}
