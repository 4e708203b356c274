package com.netflexity.anomaly.rule;

import com.netflexity.anomaly.model.Temporality;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Metric metadata lookups.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public interface MetadataSource {

    /**
     * Temporalities each metric has been reported with. Metrics the source
     * has never seen are absent from the result.
     */
    Mono<Map<String, Set<Temporality>>> fetchTemporality(List<String> metricNames);
}
