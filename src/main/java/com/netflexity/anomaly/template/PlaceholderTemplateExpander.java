package com.netflexity.anomaly.template;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expander for the placeholder subset used in alert templates:
 * {@code {{$value}}}, {@code {{$threshold}}}, {@code {{$labels.name}}},
 * their {@code .Value}, {@code .Threshold}, {@code .Labels.name} forms and
 * {@code {{index $labels "name"}}}.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public class PlaceholderTemplateExpander implements TemplateExpander {

    static final String NO_VALUE = "<no value>";

    private static final Pattern ACTION = Pattern.compile("\\{\\{-?\\s*(.*?)\\s*-?}}");
    private static final Pattern LABEL_FIELD = Pattern.compile("(?:\\$labels|\\.Labels)\\.([A-Za-z_][A-Za-z0-9_]*)");
    private static final Pattern LABEL_INDEX = Pattern.compile("index\\s+(?:\\$labels|\\.Labels)\\s+\"([^\"]*)\"");

    @Override
    public String expand(String template, TemplateData data) throws TemplateExpansionException {
        if (template == null || !template.contains("{{")) {
            return template;
        }

        StringBuilder out = new StringBuilder();
        Matcher matcher = ACTION.matcher(template);
        int last = 0;
        while (matcher.find()) {
            String literal = template.substring(last, matcher.start());
            if (literal.contains("{{")) {
                throw new TemplateExpansionException("unexpected \"{{\" in action");
            }
            out.append(literal);
            out.append(evaluate(matcher.group(1), data));
            last = matcher.end();
        }
        String tail = template.substring(last);
        if (tail.contains("{{")) {
            throw new TemplateExpansionException("unclosed action");
        }
        out.append(tail);
        return out.toString();
    }

    private String evaluate(String expression, TemplateData data) throws TemplateExpansionException {
        if ("$value".equals(expression) || ".Value".equals(expression)) {
            return data.getValue();
        }
        if ("$threshold".equals(expression) || ".Threshold".equals(expression)) {
            return data.getThreshold();
        }

        Matcher field = LABEL_FIELD.matcher(expression);
        if (field.matches()) {
            return label(data, field.group(1));
        }
        Matcher index = LABEL_INDEX.matcher(expression);
        if (index.matches()) {
            return label(data, index.group(1));
        }
        throw new TemplateExpansionException("function or variable not supported: " + expression);
    }

    private String label(TemplateData data, String name) {
        String value = data.getLabels() == null ? null : data.getLabels().get(name);
        return value == null ? NO_VALUE : value;
    }
}
