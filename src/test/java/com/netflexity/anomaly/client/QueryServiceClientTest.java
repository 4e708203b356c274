package com.netflexity.anomaly.client;

import com.netflexity.anomaly.config.QueryServiceConfig;
import com.netflexity.anomaly.history.RuleStateHistory;
import com.netflexity.anomaly.model.QueryRangeParams;
import com.netflexity.anomaly.model.QueryRangeResponse;
import com.netflexity.anomaly.model.Temporality;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryServiceClientTest {

    private static final String RANGE_BODY = """
            {"status":"success","data":{"results":[{"queryName":"A","series":[
              {"labels":{"service":"checkout"},"points":[{"timestamp":60000,"value":12.5}]}]}]}}""";

    private final List<ClientRequest> requests = new ArrayList<>();
    private final Deque<ClientResponse> responses = new ArrayDeque<>();
    private QueryServiceConfig config;

    @BeforeEach
    void setUp() {
        config = new QueryServiceConfig();
        config.setBaseUrl("http://query-service:8080");
        config.getHttp().setMaxRetries(0);
    }

    private QueryServiceClient client() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(responses.isEmpty() ? json(HttpStatus.OK, "{}") : responses.poll());
                })
                .build();
        return new QueryServiceClient(webClient, config);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    private static QueryRangeParams params() {
        return QueryRangeParams.builder().start(0).end(300_000).step(60).build();
    }

    @Test
    void queryRangeUnwrapsEnvelope() {
        responses.add(json(HttpStatus.OK, RANGE_BODY));

        QueryRangeResponse response = client().queryRange(params(), Map.of()).block();

        assertThat(response).isNotNull();
        assertThat(response.getResults()).singleElement().satisfies(result -> {
            assertThat(result.getQueryName()).isEqualTo("A");
            assertThat(result.getSeries()).singleElement().satisfies(series -> {
                assertThat(series.getLabels()).containsEntry("service", "checkout");
                assertThat(series.getPoints()).singleElement()
                        .satisfies(point -> assertThat(point.getValue()).isEqualTo(12.5));
            });
        });

        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url()).isEqualTo(URI.create("http://query-service:8080/api/v4/query_range"));
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isNull();
    }

    @Test
    void apiKeyIsSentAsBearerToken() {
        config.setApiKey("secret-token");
        responses.add(json(HttpStatus.OK, RANGE_BODY));

        client().queryRange(params(), Map.of()).block();

        assertThat(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer secret-token");
    }

    @Test
    void errorEnvelopeFailsWithoutRetry() {
        config.getHttp().setMaxRetries(2);
        responses.add(json(HttpStatus.OK, "{\"status\":\"error\",\"error\":\"unknown metric\"}"));

        assertThatThrownBy(() -> client().queryRange(params(), Map.of()).block())
                .isInstanceOf(QueryServiceException.class)
                .hasMessageContaining("unknown metric");
        assertThat(requests).hasSize(1);
    }

    @Test
    void clientErrorIsNotRetried() {
        config.getHttp().setMaxRetries(2);
        responses.add(json(HttpStatus.BAD_REQUEST, "{\"error\":\"bad query\"}"));

        assertThatThrownBy(() -> client().queryRange(params(), Map.of()).block())
                .isInstanceOfSatisfying(QueryServiceException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(400));
        assertThat(requests).hasSize(1);
    }

    @Test
    void serverErrorIsRetried() {
        config.getHttp().setMaxRetries(1);
        responses.add(json(HttpStatus.SERVICE_UNAVAILABLE, ""));
        responses.add(json(HttpStatus.OK, RANGE_BODY));

        QueryRangeResponse response = client().queryRange(params(), Map.of()).block();

        assertThat(response).isNotNull();
        assertThat(requests).hasSize(2);
    }

    @Test
    void fetchTemporalityDecodesValues() {
        responses.add(json(HttpStatus.OK,
                "{\"status\":\"success\",\"data\":{\"checkout_latency\":[\"Delta\",\"Cumulative\"],\"cpu\":[]}}"));

        Map<String, Set<Temporality>> result =
                client().fetchTemporality(List.of("checkout_latency", "cpu")).block();

        assertThat(result).containsOnlyKeys("checkout_latency", "cpu");
        assertThat(result.get("checkout_latency")).containsExactlyInAnyOrder(Temporality.DELTA, Temporality.CUMULATIVE);
        assertThat(result.get("cpu")).isEmpty();
        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/v1/metrics/temporality");
    }

    @Test
    void fetchTemporalityWithoutMetricsMakesNoCall() {
        StepVerifier.create(client().fetchTemporality(List.of()))
                .expectNext(Map.of())
                .verifyComplete();
        assertThat(requests).isEmpty();
    }

    @Test
    void historyIsPostedToHistoryEndpoint() {
        responses.add(json(HttpStatus.OK, "{\"status\":\"success\",\"data\":{}}"));
        RuleHistoryClient history = new RuleHistoryClient(client(), config);

        StepVerifier.create(history.addRuleStateHistory(
                        List.of(RuleStateHistory.builder().ruleId("rule-1").state("firing").build())))
                .verifyComplete();
        StepVerifier.create(history.addRuleStateHistory(List.of())).verifyComplete();

        assertThat(requests).singleElement()
                .satisfies(request -> assertThat(request.url().getPath()).isEqualTo("/api/v1/rules/history"));
    }

    @Test
    void retryFilterSeparatesFinalFromTransientErrors() {
        assertThat(QueryServiceClient.isRetryableError(new QueryServiceException(503, "unavailable"))).isTrue();
        assertThat(QueryServiceClient.isRetryableError(new QueryServiceException(429, "throttled"))).isTrue();
        assertThat(QueryServiceClient.isRetryableError(new QueryServiceException(404, "not found"))).isFalse();
        assertThat(QueryServiceClient.isRetryableError(new QueryServiceException(0, "error envelope"))).isFalse();
        assertThat(QueryServiceClient.isRetryableError(new WebClientRequestException(
                new ConnectException("refused"), HttpMethod.POST, URI.create("http://query-service"),
                new HttpHeaders()))).isTrue();
    }
}
