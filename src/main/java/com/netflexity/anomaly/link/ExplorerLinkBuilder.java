package com.netflexity.anomaly.link;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netflexity.anomaly.model.AttributeKey;
import com.netflexity.anomaly.model.DataSource;
import com.netflexity.anomaly.model.FilterItem;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Link into a list-view explorer showing the rows behind one alerting series.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Slf4j
public abstract class ExplorerLinkBuilder implements RelatedLinkBuilder {

    private static final int PAGE_SIZE = 100;

    private final ObjectMapper objectMapper;

    protected ExplorerLinkBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Signal listed by the explorer
     */
    protected abstract DataSource dataSource();

    /**
     * Path of the explorer page, including the trailing {@code ?}
     */
    protected abstract String explorerPath();

    /**
     * Factor converting the window's milliseconds into the explorer's time unit
     */
    protected abstract long timeMultiplier();

    protected abstract List<AttributeKey> selectColumns();

    @Override
    public Optional<String> build(LinkRequest request) {
        String selected = request.getSelectedQuery();
        // formula queries cannot be opened in the explorer
        if (!isBuilderQueryName(selected)) {
            return Optional.empty();
        }
        if (request.getHost() == null || request.getHost().isEmpty()) {
            return Optional.empty();
        }

        long start = request.getStart() * timeMultiplier();
        long end = request.getEnd() * timeMultiplier();
        List<FilterItem> filters = FilterResolver.fetchFilters(
                request.getCompositeQuery(), selected, request.getSeriesLabels());

        try {
            String query = String.format("compositeQuery=%s&timeRange=%s&startTime=%d&endTime=%d&options=%s",
                    encode(compositeQuery(filters)),
                    encode(timeRange(start, end)),
                    start,
                    end,
                    encode(options()));
            return Optional.of(request.getHost() + explorerPath() + query);
        } catch (JsonProcessingException e) {
            log.warn("Could not build {} link: {}", annotationName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Builder queries are named with a single upper case letter, formulas are not
     */
    static boolean isBuilderQueryName(String name) {
        return name != null && name.length() == 1 && name.charAt(0) >= 'A' && name.charAt(0) <= 'Z';
    }

    private Map<String, Object> compositeQuery(List<FilterItem> filters) {
        Map<String, Object> filterSet = new LinkedHashMap<>();
        filterSet.put("items", filters);
        filterSet.put("op", "AND");

        Map<String, Object> query = new LinkedHashMap<>();
        query.put("dataSource", dataSource().getValue());
        query.put("queryName", "A");
        query.put("aggregateOperator", "noop");
        query.put("aggregateAttribute", Map.of());
        query.put("filters", filterSet);
        query.put("expression", "A");
        query.put("disabled", false);
        query.put("having", List.of());
        query.put("stepInterval", 60);
        query.put("orderBy", List.of(Map.of("columnName", "timestamp", "order", "desc")));

        Map<String, Object> builder = new LinkedHashMap<>();
        builder.put("queryData", List.of(query));
        builder.put("queryFormulas", List.of());

        Map<String, Object> composite = new LinkedHashMap<>();
        composite.put("queryType", "builder");
        composite.put("builder", builder);
        return composite;
    }

    private Map<String, Object> timeRange(long start, long end) {
        Map<String, Object> range = new LinkedHashMap<>();
        range.put("start", start);
        range.put("end", end);
        range.put("pageSize", PAGE_SIZE);
        return range;
    }

    private Map<String, Object> options() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("maxLines", 2);
        options.put("format", "list");
        options.put("selectColumns", selectColumns());
        return options;
    }

    private String encode(Object value) throws JsonProcessingException {
        return URLEncoder.encode(objectMapper.writeValueAsString(value), StandardCharsets.UTF_8);
    }
}
