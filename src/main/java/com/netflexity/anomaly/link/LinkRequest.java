package com.netflexity.anomaly.link;

import com.netflexity.anomaly.model.CompositeQuery;
import com.netflexity.anomaly.rule.Labels;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs of a related-data link.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Value
@Builder
public class LinkRequest {

    /**
     * {@code scheme://host[:port]} of the UI
     */
    String host;

    /**
     * Evaluated window start, unix milliseconds
     */
    long start;

    /**
     * Evaluated window end, unix milliseconds
     */
    long end;

    String selectedQuery;

    CompositeQuery compositeQuery;

    Labels seriesLabels;
}
