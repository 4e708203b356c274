package com.netflexity.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Labelled sequence of datapoints returned by the query backend.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Series {

    private Map<String, String> labels = new LinkedHashMap<>();

    private List<Point> points = new ArrayList<>();

    /**
     * Points without the aggregate rows some backends append for grouping sets
     */
    public List<Point> timedPoints() {
        if (points == null) {
            return List.of();
        }
        return points.stream()
                .filter(point -> point.getTimestamp() != 0)
                .toList();
    }
}
