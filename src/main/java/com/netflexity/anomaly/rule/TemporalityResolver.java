package com.netflexity.anomaly.rule;

import com.netflexity.anomaly.model.BuilderQuery;
import com.netflexity.anomaly.model.QueryRangeParams;
import com.netflexity.anomaly.model.Temporality;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fills in the temporality of metric builder queries that do not declare one.
 *
 * Resolution runs in three steps: cached temporalities are applied first, the
 * remaining metric names of all windows are looked up in a single metadata
 * call, and the fetched values are then applied and cached.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Slf4j
public class TemporalityResolver {

    private final MetadataSource metadataSource;
    private final TemporalityCache cache;

    public TemporalityResolver(MetadataSource metadataSource, TemporalityCache cache) {
        this.metadataSource = metadataSource;
        this.cache = cache;
    }

    public void resolve(EvaluationContext ctx, AnomalyWindows windows) throws RuleEvaluationException {
        List<BuilderQuery> unresolved = applyCached(windows.all());
        if (unresolved.isEmpty()) {
            return;
        }

        List<String> metricNames = unresolved.stream()
                .map(BuilderQuery::metricName)
                .distinct()
                .sorted()
                .toList();
        log.debug("Fetching temporality for {} metrics: {}", metricNames.size(), metricNames);

        Map<String, Set<Temporality>> fetched = ctx.await(
                metadataSource.fetchTemporality(metricNames), "temporality lookup");

        populate(unresolved, fetched);
    }

    /**
     * Apply cached entries and return the queries still lacking a temporality
     */
    List<BuilderQuery> applyCached(List<QueryRangeParams> windows) {
        List<BuilderQuery> unresolved = new ArrayList<>();
        for (QueryRangeParams params : windows) {
            for (BuilderQuery query : params.getCompositeQuery().getBuilderQueries().values()) {
                if (!needsResolution(query)) {
                    continue;
                }
                Set<Temporality> cached = cache.get(query.metricName());
                if (cached != null) {
                    query.setTemporality(Temporality.preferred(cached));
                } else {
                    unresolved.add(query);
                }
            }
        }
        return unresolved;
    }

    void populate(List<BuilderQuery> unresolved, Map<String, Set<Temporality>> fetched) {
        fetched.forEach(cache::put);
        for (BuilderQuery query : unresolved) {
            Set<Temporality> known = fetched.get(query.metricName());
            if (known == null || known.isEmpty()) {
                log.debug("No temporality known for metric {}", query.metricName());
            }
            query.setTemporality(Temporality.preferred(known));
        }
    }

    private boolean needsResolution(BuilderQuery query) {
        return query.getTemporality() == null && query.metricName() != null;
    }
}
