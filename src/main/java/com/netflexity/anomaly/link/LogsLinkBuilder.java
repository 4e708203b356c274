package com.netflexity.anomaly.link;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netflexity.anomaly.model.AttributeKey;
import com.netflexity.anomaly.model.DataSource;
import com.netflexity.anomaly.rule.AlertType;

import java.util.List;

/**
 * Links logs-based alerts to the logs explorer. Times are in milliseconds.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public class LogsLinkBuilder extends ExplorerLinkBuilder {

    public LogsLinkBuilder(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public AlertType alertType() {
        return AlertType.LOGS_BASED_ALERT;
    }

    @Override
    public String annotationName() {
        return "related_logs";
    }

    @Override
    protected DataSource dataSource() {
        return DataSource.LOGS;
    }

    @Override
    protected String explorerPath() {
        return "/logs/logs-explorer?";
    }

    @Override
    protected long timeMultiplier() {
        return 1L;
    }

    @Override
    protected List<AttributeKey> selectColumns() {
        return List.of();
    }
}
