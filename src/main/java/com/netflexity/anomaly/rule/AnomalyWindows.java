package com.netflexity.anomaly.rule;

import com.netflexity.anomaly.model.QueryRangeParams;
import lombok.Value;

import java.util.List;

/**
 * The four aligned query windows one anomaly evaluation reads.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Value
public class AnomalyWindows {

    /**
     * The evaluated window itself
     */
    QueryRangeParams current;

    /**
     * Same time of day one season earlier, padded on both sides
     */
    QueryRangeParams priorPeriod;

    /**
     * The week leading up to the evaluated window
     */
    QueryRangeParams currentWeek;

    /**
     * The week before {@link #currentWeek}
     */
    QueryRangeParams priorWeek;

    public List<QueryRangeParams> all() {
        return List.of(current, priorPeriod, currentWeek, priorWeek);
    }
}
