package com.netflexity.anomaly.rule;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netflexity.anomaly.history.EvaluationRecorder;
import com.netflexity.anomaly.link.RelatedLinks;
import com.netflexity.anomaly.template.TemplateExpander;
import lombok.Builder;
import lombok.Value;

/**
 * Collaborators shared by the rules of one engine.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Value
@Builder
public class RuleDependencies {

    Querier querier;

    MetadataSource metadataSource;

    TemporalityCache temporalityCache;

    TemplateExpander templateExpander;

    RelatedLinks relatedLinks;

    EvaluationRecorder recorder;

    ObjectMapper objectMapper;
}
