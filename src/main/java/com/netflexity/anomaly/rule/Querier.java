package com.netflexity.anomaly.rule;

import com.netflexity.anomaly.model.AttributeKey;
import com.netflexity.anomaly.model.QueryRangeParams;
import com.netflexity.anomaly.model.QueryRangeResponse;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Executes range queries against the time-series backend.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public interface Querier {

    /**
     * Run the composite query of {@code params} over its window.
     *
     * @param params query window, step and composite query
     * @param keys   attribute key hints, may be empty
     * @return results per query name plus backend warnings
     */
    Mono<QueryRangeResponse> queryRange(QueryRangeParams params, Map<String, AttributeKey> keys);
}
