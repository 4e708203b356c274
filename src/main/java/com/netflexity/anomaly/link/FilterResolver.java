package com.netflexity.anomaly.link;

import com.netflexity.anomaly.model.AttributeKey;
import com.netflexity.anomaly.model.BuilderQuery;
import com.netflexity.anomaly.model.CompositeQuery;
import com.netflexity.anomaly.model.FilterItem;
import com.netflexity.anomaly.model.QueryType;
import com.netflexity.anomaly.rule.Labels;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Narrows the selected query's where clause down to one series.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public final class FilterResolver {

    private FilterResolver() {
    }

    /**
     * Filters of the selected builder query, with every item whose key is a series
     * label replaced by an equality on the label value, followed by equalities for
     * the remaining series labels.
     */
    public static List<FilterItem> fetchFilters(CompositeQuery query, String selectedQuery, Labels seriesLabels) {
        List<FilterItem> items = new ArrayList<>();
        Set<String> added = new HashSet<>();

        BuilderQuery selected = query != null && query.getQueryType() == QueryType.BUILDER
                ? query.getBuilderQueries().get(selectedQuery) : null;
        if (selected != null && selected.getFilters() != null && selected.getFilters().getItems() != null) {
            for (FilterItem item : selected.getFilters().getItems()) {
                String key = item.getKey() != null ? item.getKey().getKey() : null;
                String value = key != null ? seriesLabels.get(key) : null;
                if (value != null) {
                    items.add(FilterItem.equal(item.getKey().copy(), value));
                    added.add(key);
                } else {
                    items.add(item.copy());
                }
            }
        }

        for (Labels.Label label : seriesLabels) {
            if (!added.contains(label.getName())) {
                items.add(FilterItem.equal(AttributeKey.of(label.getName()), label.getValue()));
            }
        }
        return items;
    }
}
