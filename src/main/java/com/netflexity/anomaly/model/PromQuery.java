package com.netflexity.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw PromQL query.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PromQuery {

    private String query;

    private boolean disabled;

    public PromQuery copy() {
        return new PromQuery(query, disabled);
    }
}
