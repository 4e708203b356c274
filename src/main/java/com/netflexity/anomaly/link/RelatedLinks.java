package com.netflexity.anomaly.link;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netflexity.anomaly.rule.AlertType;
import com.netflexity.anomaly.rule.Labels;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of related-data link builders keyed by alert type.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public class RelatedLinks {

    private final Map<AlertType, RelatedLinkBuilder> builders = new EnumMap<>(AlertType.class);

    public RelatedLinks(List<RelatedLinkBuilder> builders) {
        builders.forEach(builder -> this.builders.put(builder.alertType(), builder));
    }

    /**
     * Logs and traces explorer links
     */
    public static RelatedLinks defaults(ObjectMapper objectMapper) {
        return new RelatedLinks(List.of(new LogsLinkBuilder(objectMapper), new TracesLinkBuilder(objectMapper)));
    }

    public static RelatedLinks none() {
        return new RelatedLinks(List.of());
    }

    /**
     * Annotation carrying the related link for an alert of {@code alertType}, if any
     */
    public Optional<Labels.Label> annotationFor(AlertType alertType, LinkRequest request) {
        RelatedLinkBuilder builder = alertType == null ? null : builders.get(alertType);
        if (builder == null) {
            return Optional.empty();
        }
        return builder.build(request).map(link -> new Labels.Label(builder.annotationName(), link));
    }
}
