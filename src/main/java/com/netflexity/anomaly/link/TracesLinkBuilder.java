package com.netflexity.anomaly.link;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netflexity.anomaly.model.AttributeKey;
import com.netflexity.anomaly.model.DataSource;
import com.netflexity.anomaly.rule.AlertType;

import java.util.List;

/**
 * Links traces-based alerts to the traces explorer. Times are in nanoseconds.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public class TracesLinkBuilder extends ExplorerLinkBuilder {

    static final List<AttributeKey> DEFAULT_COLUMNS = List.of(
            new AttributeKey("serviceName", "string", "tag", true),
            new AttributeKey("name", "string", "tag", true),
            new AttributeKey("durationNano", "float64", "tag", true),
            new AttributeKey("httpMethod", "string", "tag", true),
            new AttributeKey("responseStatusCode", "string", "tag", true));

    public TracesLinkBuilder(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public AlertType alertType() {
        return AlertType.TRACES_BASED_ALERT;
    }

    @Override
    public String annotationName() {
        return "related_traces";
    }

    @Override
    protected DataSource dataSource() {
        return DataSource.TRACES;
    }

    @Override
    protected String explorerPath() {
        return "/traces-explorer?";
    }

    @Override
    protected long timeMultiplier() {
        return 1_000_000L;
    }

    @Override
    protected List<AttributeKey> selectColumns() {
        return DEFAULT_COLUMNS;
    }
}
