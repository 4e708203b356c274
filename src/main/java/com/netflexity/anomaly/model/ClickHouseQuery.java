package com.netflexity.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw SQL query executed against the ClickHouse store.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClickHouseQuery {

    private String query;

    private boolean disabled;

    public ClickHouseQuery copy() {
        return new ClickHouseQuery(query, disabled);
    }
}
