package com.netflexity.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Conjunction (or disjunction) of filter items.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FilterSet {

    private String op = "AND";

    private List<FilterItem> items = new ArrayList<>();

    public FilterSet copy() {
        List<FilterItem> copied = new ArrayList<>();
        if (items != null) {
            items.forEach(item -> copied.add(item.copy()));
        }
        return new FilterSet(op, copied);
    }
}
