package com.netflexity.anomaly.rule;

import com.netflexity.anomaly.model.CompositeQuery;
import com.netflexity.anomaly.model.QueryType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.NavigableSet;

/**
 * Declarative comparison a rule applies to its query results.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
public class RuleCondition {

    /**
     * Query producing the series to score
     */
    @NotNull
    @Valid
    private CompositeQuery compositeQuery;

    /**
     * Comparison between score and target
     */
    private CompareOp compareOp = CompareOp.NONE;

    /**
     * Reduction of per-point scores
     */
    private MatchType matchType = MatchType.NONE;

    /**
     * Score threshold
     */
    private Double target;

    /**
     * Raise a no-data alert when the query stops returning series
     */
    private boolean alertOnAbsent;

    /**
     * Minutes without data before a no-data alert is raised
     */
    @Min(0)
    private int absentFor;

    /**
     * Unit the target is expressed in
     */
    private String targetUnit;

    /**
     * Query whose result is evaluated. Derived from the query names when blank.
     */
    private String selectedQuery;

    /**
     * Reject conditions that cannot be evaluated
     */
    public void validate() throws InvalidRuleException {
        if (compositeQuery == null) {
            throw new InvalidRuleException("composite query is required");
        }
        try {
            compositeQuery.validate();
        } catch (CompositeQuery.InvalidQueryException e) {
            throw new InvalidRuleException("invalid composite query: " + e.getMessage(), e);
        }
        QueryType queryType = compositeQuery.getQueryType();
        if (queryType == QueryType.BUILDER) {
            if (target == null) {
                throw new InvalidRuleException("target is required for builder queries");
            }
            if (compareOp == null || compareOp == CompareOp.NONE) {
                throw new InvalidRuleException("invalid compare op");
            }
        }
        if (queryType == QueryType.PROMQL
                && (compositeQuery.getPromQueries() == null || compositeQuery.getPromQueries().isEmpty())) {
            throw new InvalidRuleException("no promql query found");
        }
        if (selectedQuery != null && !selectedQuery.isBlank()
                && !compositeQuery.queryNames().contains(selectedQuery)) {
            throw new InvalidRuleException("selected query " + selectedQuery + " is not defined");
        }
    }

    public double targetValue() {
        return target != null ? target : 0;
    }

    /**
     * Name of the query whose result is evaluated: the explicit selection,
     * else F1 when defined, else the lexically greatest query name.
     */
    public String selectedQueryName() {
        if (selectedQuery != null && !selectedQuery.isBlank()) {
            return selectedQuery;
        }
        if (compositeQuery == null) {
            return "";
        }
        NavigableSet<String> names = compositeQuery.queryNames();
        if (names.contains("F1")) {
            return "F1";
        }
        return names.isEmpty() ? "" : names.last();
    }
}
