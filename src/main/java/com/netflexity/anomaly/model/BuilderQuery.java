package com.netflexity.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured query assembled by the query builder.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BuilderQuery {

    /**
     * Query name, referenced by formulas and by the rule's selected query
     */
    private String queryName;

    /**
     * Signal this query reads
     */
    private DataSource dataSource = DataSource.METRICS;

    /**
     * Attribute being aggregated, the metric name for metric queries
     */
    private AttributeKey aggregateAttribute = new AttributeKey();

    /**
     * Aggregation operator (e.g. sum, avg, rate, noop)
     */
    private String aggregateOperator;

    /**
     * Metric temporality, resolved from metadata when unset
     */
    private Temporality temporality;

    /**
     * Step interval in seconds
     */
    private long stepInterval = 60;

    /**
     * Where clause
     */
    private FilterSet filters;

    /**
     * Group-by attributes
     */
    private List<AttributeKey> groupBy = new ArrayList<>();

    /**
     * Expression, equal to the query name for plain queries
     */
    private String expression;

    /**
     * Disabled queries are executed but not returned
     */
    private boolean disabled;

    public BuilderQuery copy() {
        BuilderQuery copy = new BuilderQuery();
        copy.setQueryName(queryName);
        copy.setDataSource(dataSource);
        copy.setAggregateAttribute(aggregateAttribute != null ? aggregateAttribute.copy() : null);
        copy.setAggregateOperator(aggregateOperator);
        copy.setTemporality(temporality);
        copy.setStepInterval(stepInterval);
        copy.setFilters(filters != null ? filters.copy() : null);
        List<AttributeKey> groups = new ArrayList<>();
        if (groupBy != null) {
            groupBy.forEach(key -> groups.add(key.copy()));
        }
        copy.setGroupBy(groups);
        copy.setExpression(expression);
        copy.setDisabled(disabled);
        return copy;
    }

    /**
     * Metric name queried, or null when this is not a metrics query
     */
    public String metricName() {
        if (dataSource != DataSource.METRICS || aggregateAttribute == null) {
            return null;
        }
        String key = aggregateAttribute.getKey();
        return key == null || key.isBlank() ? null : key;
    }
}
