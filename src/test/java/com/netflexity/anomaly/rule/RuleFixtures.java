package com.netflexity.anomaly.rule;

import com.netflexity.anomaly.model.AttributeKey;
import com.netflexity.anomaly.model.BuilderQuery;
import com.netflexity.anomaly.model.CompositeQuery;
import com.netflexity.anomaly.model.Point;
import com.netflexity.anomaly.model.QueryRangeParams;
import com.netflexity.anomaly.model.QueryRangeResponse;
import com.netflexity.anomaly.model.QueryResult;
import com.netflexity.anomaly.model.Series;
import com.netflexity.anomaly.model.Temporality;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builders shared by the rule tests.
 */
final class RuleFixtures {

    static final Map<String, String> CHECKOUT = Map.of("service", "checkout");

    private RuleFixtures() {
    }

    static Series series(Map<String, String> labels, double... values) {
        List<Point> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new Point(1_000L * (i + 1), values[i]));
        }
        return new Series(new LinkedHashMap<>(labels), points);
    }

    static QueryRangeResponse response(Series... series) {
        return new QueryRangeResponse(
                new ArrayList<>(List.of(new QueryResult("A", new ArrayList<>(List.of(series))))),
                new ArrayList<>());
    }

    static CompositeQuery latencyQuery() {
        BuilderQuery query = new BuilderQuery();
        query.setQueryName("A");
        query.setExpression("A");
        query.setAggregateOperator("avg");
        query.setAggregateAttribute(AttributeKey.of("checkout_latency"));
        query.setTemporality(Temporality.DELTA);
        query.getGroupBy().add(AttributeKey.of("service"));

        CompositeQuery composite = new CompositeQuery();
        composite.getBuilderQueries().put("A", query);
        return composite;
    }

    static RuleCondition condition(CompareOp op, MatchType matchType, double target) {
        RuleCondition condition = new RuleCondition();
        condition.setCompositeQuery(latencyQuery());
        condition.setCompareOp(op);
        condition.setMatchType(matchType);
        condition.setTarget(target);
        return condition;
    }

    static RuleDefinition definition(RuleCondition condition) {
        RuleDefinition definition = new RuleDefinition();
        definition.setId("rule-1");
        definition.setAlertName("Checkout latency");
        definition.setSource("https://obs.example.com/alerts/new");
        definition.setEvalWindow(Duration.ofMinutes(5));
        definition.setCondition(condition);
        return definition;
    }

    /**
     * Querier answering each anomaly window with a fixed response.
     * Windows are told apart by their length, which the planner fixes.
     */
    static final class StubQuerier implements Querier {

        private static final long CURRENT = Duration.ofMinutes(5).toMillis();
        private static final long PRIOR_PERIOD = Duration.ofHours(4).plusMinutes(5).toMillis();
        private static final long CURRENT_WEEK = Duration.ofDays(7).plusMinutes(5).toMillis();

        QueryRangeResponse current = response();
        QueryRangeResponse priorPeriod = response();
        QueryRangeResponse currentWeek = response();
        QueryRangeResponse priorWeek = response();
        RuntimeException failure;
        boolean hang;
        final AtomicInteger calls = new AtomicInteger();

        /**
         * Baseline with average 10 and a current-week standard deviation of 2,
         * so the score of a current value v is (v - 10) / 2
         */
        StubQuerier withBaseline(Map<String, String> labels) {
            priorPeriod = append(priorPeriod, series(labels, 10, 10));
            currentWeek = append(currentWeek, series(labels, 8, 12));
            priorWeek = append(priorWeek, series(labels, 10, 10));
            return this;
        }

        StubQuerier withCurrent(Series... series) {
            current = response(series);
            return this;
        }

        @Override
        public Mono<QueryRangeResponse> queryRange(QueryRangeParams params, Map<String, AttributeKey> keys) {
            calls.incrementAndGet();
            if (failure != null) {
                return Mono.error(failure);
            }
            if (hang) {
                return Mono.never();
            }
            long length = params.getEnd() - params.getStart();
            if (length == CURRENT) {
                return Mono.just(current);
            }
            if (length == PRIOR_PERIOD) {
                return Mono.just(priorPeriod);
            }
            if (length == CURRENT_WEEK) {
                return Mono.just(currentWeek);
            }
            return Mono.just(priorWeek);
        }

        private static QueryRangeResponse append(QueryRangeResponse response, Series series) {
            response.getResults().get(0).getSeries().add(series);
            return response;
        }
    }
}
