package com.netflexity.anomaly.link;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Helpers deriving URLs from the page a rule was created on.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public final class SourceUrls {

    private SourceUrls() {
    }

    /**
     * URL of the rule's edit page.
     *
     * A source ending in the rule creation page ({@code .../new}) is turned
     * into the matching edit page; any other source is reduced to its host.
     * Empty or unparsable sources give an empty URL.
     */
    public static String generatorUrl(String source, String ruleId) {
        if (source == null || source.isEmpty()) {
            return "";
        }
        URI uri = parse(source);
        if (uri == null) {
            return "";
        }
        int newIndex = source.lastIndexOf("new");
        if (newIndex > -1) {
            return source.substring(0, newIndex) + "edit?ruleId=" + ruleId;
        }
        String host = host(uri);
        return host.isEmpty() ? "" : host + "/alerts/edit?ruleId=" + ruleId;
    }

    /**
     * {@code scheme://host[:port]} of the source, empty when it has no host
     */
    public static String host(String source) {
        if (source == null || source.isEmpty()) {
            return "";
        }
        URI uri = parse(source);
        return uri == null ? "" : host(uri);
    }

    private static String host(URI uri) {
        if (uri.getScheme() == null || uri.getHost() == null) {
            return "";
        }
        if (uri.getPort() != -1) {
            return String.format("%s://%s:%d", uri.getScheme(), uri.getHost(), uri.getPort());
        }
        return String.format("%s://%s", uri.getScheme(), uri.getHost());
    }

    private static URI parse(String source) {
        try {
            return new URI(source);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
