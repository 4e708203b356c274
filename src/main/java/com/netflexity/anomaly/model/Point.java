package com.netflexity.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One datapoint of a series.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Point {

    /**
     * Unix milliseconds. Zero marks an aggregate (grouping set) row.
     */
    private long timestamp;

    private double value;
}
