package com.netflexity.anomaly.rule;

import com.netflexity.anomaly.model.BuilderQuery;
import com.netflexity.anomaly.model.CompositeQuery;
import com.netflexity.anomaly.model.PromQuery;
import com.netflexity.anomaly.model.QueryType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleConditionTest {

    private static RuleCondition condition() {
        return RuleFixtures.condition(CompareOp.ABOVE, MatchType.AT_LEAST_ONCE, 2);
    }

    @Test
    void validBuilderCondition() {
        assertThatCode(() -> condition().validate()).doesNotThrowAnyException();
    }

    @Test
    void builderConditionNeedsTarget() {
        RuleCondition condition = condition();
        condition.setTarget(null);

        assertThatThrownBy(condition::validate).isInstanceOf(InvalidRuleException.class).hasMessageContaining("target");
    }

    @Test
    void builderConditionNeedsCompareOp() {
        RuleCondition condition = condition();
        condition.setCompareOp(CompareOp.NONE);

        assertThatThrownBy(condition::validate).isInstanceOf(InvalidRuleException.class);
    }

    @Test
    void compositeQueryIsRequired() {
        RuleCondition condition = condition();
        condition.setCompositeQuery(null);

        assertThatThrownBy(condition::validate).isInstanceOf(InvalidRuleException.class);
    }

    @Test
    void promqlConditionNeedsQueries() {
        RuleCondition condition = condition();
        CompositeQuery query = new CompositeQuery();
        query.setQueryType(QueryType.PROMQL);
        condition.setCompositeQuery(query);

        assertThatThrownBy(condition::validate).isInstanceOf(InvalidRuleException.class);

        PromQuery prom = new PromQuery();
        prom.setQuery("rate(http_requests_total[5m])");
        query.getPromQueries().put("A", prom);
        assertThatCode(condition::validate).doesNotThrowAnyException();
    }

    @Test
    void selectedQueryMustExist() {
        RuleCondition condition = condition();
        condition.setSelectedQuery("B");

        assertThatThrownBy(condition::validate).isInstanceOf(InvalidRuleException.class).hasMessageContaining("B");
    }

    @Test
    void validationFillsInQueryNameAndExpression() throws Exception {
        RuleCondition condition = condition();
        BuilderQuery query = condition.getCompositeQuery().getBuilderQueries().get("A");
        query.setQueryName(null);
        query.setExpression(null);

        condition.validate();

        assertThat(query.getQueryName()).isEqualTo("A");
        assertThat(query.getExpression()).isEqualTo("A");
    }

    @Test
    void selectedQueryPrefersExplicitThenFormulaThenLastName() {
        RuleCondition condition = condition();
        CompositeQuery query = condition.getCompositeQuery();
        query.getBuilderQueries().put("C", new BuilderQuery());
        query.getBuilderQueries().put("B", new BuilderQuery());
        assertThat(condition.selectedQueryName()).isEqualTo("C");

        query.getBuilderQueries().put("F1", new BuilderQuery());
        assertThat(condition.selectedQueryName()).isEqualTo("F1");

        condition.setSelectedQuery("B");
        assertThat(condition.selectedQueryName()).isEqualTo("B");
    }
}
