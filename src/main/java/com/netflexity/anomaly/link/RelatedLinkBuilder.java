package com.netflexity.anomaly.link;

import com.netflexity.anomaly.rule.AlertType;

import java.util.Optional;

/**
 * Builds a link from an alert to the raw data behind it.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public interface RelatedLinkBuilder {

    /**
     * Alert type this builder serves
     */
    AlertType alertType();

    /**
     * Annotation the link is stored under
     */
    String annotationName();

    /**
     * Full link, or empty when no link can be built for the request
     */
    Optional<String> build(LinkRequest request);
}
