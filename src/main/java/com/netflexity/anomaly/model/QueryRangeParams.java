package com.netflexity.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Range query request: one window, one step, one composite query.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRangeParams {

    /**
     * Window start, unix milliseconds
     */
    private long start;

    /**
     * Window end, unix milliseconds
     */
    private long end;

    /**
     * Step in seconds
     */
    private long step;

    private CompositeQuery compositeQuery;

    @Builder.Default
    private Map<String, Object> variables = new LinkedHashMap<>();

    private boolean noCache;
}
