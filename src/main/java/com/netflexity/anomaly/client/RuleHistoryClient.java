package com.netflexity.anomaly.client;

import com.netflexity.anomaly.config.QueryServiceConfig;
import com.netflexity.anomaly.history.HistoryStore;
import com.netflexity.anomaly.history.RuleStateHistory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Writes rule state history records to the query service.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Slf4j
public class RuleHistoryClient implements HistoryStore {

    static final String HISTORY_PATH = "/api/v1/rules/history";

    private final QueryServiceClient queryServiceClient;

    public RuleHistoryClient(QueryServiceClient queryServiceClient, QueryServiceConfig config) {
        this.queryServiceClient = queryServiceClient;
        log.info("Rule state history is written to {}{}", config.getBaseUrl(), HISTORY_PATH);
    }

    @Override
    public Mono<Void> addRuleStateHistory(List<RuleStateHistory> records) {
        if (records == null || records.isEmpty()) {
            return Mono.empty();
        }
        log.debug("Writing {} rule state history records", records.size());

        return queryServiceClient.post(HISTORY_PATH, records,
                        new ParameterizedTypeReference<ApiResponse<Map<String, Object>>>() {},
                        "write rule state history")
                .then();
    }
}
