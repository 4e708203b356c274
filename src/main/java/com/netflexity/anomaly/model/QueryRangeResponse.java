package com.netflexity.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Results of a range query plus any non-fatal warnings raised by the backend.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryRangeResponse {

    private List<QueryResult> results = new ArrayList<>();

    private List<String> warnings = new ArrayList<>();

    public Optional<QueryResult> find(String queryName) {
        if (results == null) {
            return Optional.empty();
        }
        return results.stream()
                .filter(result -> result.getQueryName() != null && result.getQueryName().equals(queryName))
                .findFirst();
    }
}
