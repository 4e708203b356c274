package com.netflexity.anomaly.template;

/**
 * Expands placeholders in alert label and annotation templates.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public interface TemplateExpander {

    String expand(String template, TemplateData data) throws TemplateExpansionException;
}
