package com.netflexity.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Query definition of a rule: one of builder, SQL or PromQL queries keyed by name.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class CompositeQuery {

    /**
     * Which of the query maps is active
     */
    private QueryType queryType = QueryType.BUILDER;

    /**
     * Requested result shape
     */
    private PanelType panelType = PanelType.GRAPH;

    /**
     * Unit of the query result, used for value formatting
     */
    private String unit;

    private Map<String, BuilderQuery> builderQueries = new LinkedHashMap<>();

    private Map<String, PromQuery> promQueries = new LinkedHashMap<>();

    private Map<String, ClickHouseQuery> chQueries = new LinkedHashMap<>();

    /**
     * Copy every nested query so that the copy can be mutated freely
     */
    public CompositeQuery deepCopy() {
        CompositeQuery copy = new CompositeQuery();
        copy.setQueryType(queryType);
        copy.setPanelType(panelType);
        copy.setUnit(unit);
        Map<String, BuilderQuery> builders = new LinkedHashMap<>();
        if (builderQueries != null) {
            builderQueries.forEach((name, query) -> builders.put(name, query.copy()));
        }
        copy.setBuilderQueries(builders);
        Map<String, PromQuery> proms = new LinkedHashMap<>();
        if (promQueries != null) {
            promQueries.forEach((name, query) -> proms.put(name, query.copy()));
        }
        copy.setPromQueries(proms);
        Map<String, ClickHouseQuery> sqls = new LinkedHashMap<>();
        if (chQueries != null) {
            chQueries.forEach((name, query) -> sqls.put(name, query.copy()));
        }
        copy.setChQueries(sqls);
        return copy;
    }

    /**
     * Names of the queries of the active query type, sorted
     */
    public NavigableSet<String> queryNames() {
        Map<String, ?> active = switch (queryType) {
            case BUILDER -> builderQueries;
            case CLICKHOUSE_SQL -> chQueries;
            case PROMQL -> promQueries;
            case UNKNOWN -> Map.of();
        };
        return active == null ? new TreeSet<>() : new TreeSet<>(active.keySet());
    }

    /**
     * Check the query is structurally usable
     */
    public void validate() throws InvalidQueryException {
        if (queryType == null || queryType == QueryType.UNKNOWN) {
            throw new InvalidQueryException("query type is required");
        }
        switch (queryType) {
            case BUILDER -> {
                if (builderQueries == null || builderQueries.isEmpty()) {
                    throw new InvalidQueryException("at least one builder query is required");
                }
                for (Map.Entry<String, BuilderQuery> entry : builderQueries.entrySet()) {
                    BuilderQuery query = entry.getValue();
                    if (query == null) {
                        throw new InvalidQueryException("builder query " + entry.getKey() + " is empty");
                    }
                    if (query.getQueryName() == null || query.getQueryName().isBlank()) {
                        query.setQueryName(entry.getKey());
                    }
                    if (query.getDataSource() == null) {
                        throw new InvalidQueryException("data source is required for query " + entry.getKey());
                    }
                    if (query.getExpression() == null || query.getExpression().isBlank()) {
                        query.setExpression(query.getQueryName());
                    }
                }
            }
            case CLICKHOUSE_SQL -> {
                if (chQueries == null || chQueries.isEmpty()) {
                    throw new InvalidQueryException("at least one clickhouse query is required");
                }
                for (Map.Entry<String, ClickHouseQuery> entry : chQueries.entrySet()) {
                    if (entry.getValue() == null || entry.getValue().getQuery() == null
                            || entry.getValue().getQuery().isBlank()) {
                        throw new InvalidQueryException("clickhouse query " + entry.getKey() + " is empty");
                    }
                }
            }
            case PROMQL -> {
                if (promQueries == null || promQueries.isEmpty()) {
                    throw new InvalidQueryException("at least one promql query is required");
                }
                for (Map.Entry<String, PromQuery> entry : promQueries.entrySet()) {
                    if (entry.getValue() == null || entry.getValue().getQuery() == null
                            || entry.getValue().getQuery().isBlank()) {
                        throw new InvalidQueryException("promql query " + entry.getKey() + " is empty");
                    }
                }
            }
            default -> throw new InvalidQueryException("unsupported query type " + queryType);
        }
    }

    /**
     * Thrown when a composite query cannot be executed as defined
     */
    public static class InvalidQueryException extends Exception {
        public InvalidQueryException(String message) {
            super(message);
        }
    }
}
