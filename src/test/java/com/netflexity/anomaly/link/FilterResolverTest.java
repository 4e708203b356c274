package com.netflexity.anomaly.link;

import com.netflexity.anomaly.model.AttributeKey;
import com.netflexity.anomaly.model.BuilderQuery;
import com.netflexity.anomaly.model.CompositeQuery;
import com.netflexity.anomaly.model.FilterItem;
import com.netflexity.anomaly.model.FilterSet;
import com.netflexity.anomaly.rule.Labels;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class FilterResolverTest {

    private static CompositeQuery query(FilterItem... items) {
        BuilderQuery builder = new BuilderQuery();
        builder.setQueryName("A");
        builder.setFilters(new FilterSet("AND", new ArrayList<>(List.of(items))));
        CompositeQuery query = new CompositeQuery();
        query.getBuilderQueries().put("A", builder);
        return query;
    }

    @Test
    void seriesLabelsPinMatchingFilterKeys() {
        CompositeQuery query = query(
                new FilterItem(AttributeKey.of("service"), "in", List.of("checkout", "cart")),
                new FilterItem(AttributeKey.of("env"), "=", "prod"));
        Labels series = Labels.fromMap(Map.of("service", "checkout", "region", "eu-west-1"));

        List<FilterItem> filters = FilterResolver.fetchFilters(query, "A", series);

        assertThat(filters)
                .extracting(item -> item.getKey().getKey(), FilterItem::getOp, FilterItem::getValue)
                .containsExactly(
                        tuple("service", "=", "checkout"),
                        tuple("env", "=", "prod"),
                        tuple("region", "=", "eu-west-1"));
    }

    @Test
    void originalQueryIsNotModified() {
        FilterItem original = new FilterItem(AttributeKey.of("service"), "in", List.of("checkout"));
        CompositeQuery query = query(original);

        FilterResolver.fetchFilters(query, "A", Labels.fromMap(Map.of("service", "checkout")));

        assertThat(original.getOp()).isEqualTo("in");
    }

    @Test
    void unknownQueryUsesSeriesLabelsOnly() {
        List<FilterItem> filters = FilterResolver.fetchFilters(
                query(), "B", Labels.fromMap(Map.of("service", "checkout")));

        assertThat(filters).singleElement()
                .satisfies(item -> assertThat(item.getValue()).isEqualTo("checkout"));
    }
}
