package com.netflexity.anomaly.template;

/**
 * Thrown when a template cannot be expanded.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public class TemplateExpansionException extends Exception {

    public TemplateExpansionException(String message) {
        super(message);
    }
}
