package com.netflexity.anomaly.rule;

import com.netflexity.anomaly.model.Temporality;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metric name to known temporalities, shared by all rules.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public class TemporalityCache {

    private final Map<String, Set<Temporality>> entries = new ConcurrentHashMap<>();

    /**
     * Cached temporalities of {@code metricName}, or null when unknown
     */
    public Set<Temporality> get(String metricName) {
        return entries.get(metricName);
    }

    public void put(String metricName, Set<Temporality> temporalities) {
        if (temporalities == null || temporalities.isEmpty()) {
            return;
        }
        entries.put(metricName, Set.copyOf(EnumSet.copyOf(temporalities)));
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
