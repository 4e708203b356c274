package com.netflexity.anomaly.rule;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Immutable label set, kept sorted by name.
 *
 * The {@link #hash()} fingerprint depends only on the name/value pairs, never
 * on insertion order, and is the identity of an alert within a rule.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public final class Labels implements Iterable<Labels.Label> {

    public static final String METRIC_NAME = "__name__";
    public static final String TEMPORALITY = "__temporality__";
    public static final String ALERT_NAME = "alertname";
    public static final String RULE_ID = "ruleId";
    public static final String RULE_SOURCE = "ruleSource";
    public static final String LAST_SEEN = "lastSeen";

    private static final Pattern INVALID_NAME_CHARS = Pattern.compile("[^a-zA-Z0-9_]");

    private static final Labels EMPTY = new Labels(List.of());

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;
    private static final byte SEPARATOR = (byte) 0xff;

    private final List<Label> labels;

    private Labels(List<Label> sorted) {
        this.labels = sorted;
    }

    public static Labels empty() {
        return EMPTY;
    }

    public static Labels fromMap(Map<String, String> map) {
        if (map == null || map.isEmpty()) {
            return EMPTY;
        }
        return builder().setAll(map).build();
    }

    public static Builder builder() {
        return new Builder(EMPTY);
    }

    /**
     * Make {@code name} a valid label name: invalid characters become underscores
     * and a leading digit is prefixed with one.
     */
    public static String normalizeName(String name) {
        String normalized = INVALID_NAME_CHARS.matcher(name).replaceAll("_");
        if (!normalized.isEmpty() && Character.isDigit(normalized.charAt(0))) {
            normalized = "_" + normalized;
        }
        return normalized;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public String get(String name) {
        for (Label label : labels) {
            if (label.getName().equals(name)) {
                return label.getValue();
            }
        }
        return null;
    }

    public boolean has(String name) {
        return get(name) != null;
    }

    public int size() {
        return labels.size();
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    public List<Label> asList() {
        return labels;
    }

    @JsonValue
    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        labels.forEach(label -> map.put(label.getName(), label.getValue()));
        return map;
    }

    /**
     * 64-bit FNV-1a over the sorted name/value pairs
     */
    public long hash() {
        long hash = FNV_OFFSET_BASIS;
        for (Label label : labels) {
            hash = mix(hash, label.getName().getBytes(StandardCharsets.UTF_8));
            hash = mix(hash, SEPARATOR);
            hash = mix(hash, label.getValue().getBytes(StandardCharsets.UTF_8));
            hash = mix(hash, SEPARATOR);
        }
        return hash;
    }

    private static long mix(long hash, byte[] bytes) {
        for (byte b : bytes) {
            hash = mix(hash, b);
        }
        return hash;
    }

    private static long mix(long hash, byte b) {
        hash ^= (b & 0xff);
        return hash * FNV_PRIME;
    }

    @Override
    public Iterator<Label> iterator() {
        return labels.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Labels other)) {
            return false;
        }
        return labels.equals(other.labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < labels.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(labels.get(i).getName()).append("=\"").append(labels.get(i).getValue()).append('"');
        }
        return sb.append('}').toString();
    }

    /**
     * Name/value pair
     */
    @Value
    public static class Label {
        String name;
        String value;
    }

    /**
     * Mutable builder starting from an existing label set
     */
    public static final class Builder {

        private final TreeMap<String, String> values = new TreeMap<>();

        private Builder(Labels base) {
            base.forEach(label -> values.put(label.getName(), label.getValue()));
        }

        public Builder set(String name, String value) {
            if (value == null || value.isEmpty()) {
                values.remove(name);
            } else {
                values.put(name, value);
            }
            return this;
        }

        public Builder setAll(Map<String, String> map) {
            map.forEach(this::set);
            return this;
        }

        public Builder del(String... names) {
            for (String name : names) {
                values.remove(name);
            }
            return this;
        }

        public Labels build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            List<Label> sorted = new ArrayList<>(values.size());
            values.forEach((name, value) -> sorted.add(new Label(name, value)));
            sorted.sort(Comparator.comparing(Label::getName));
            return new Labels(Collections.unmodifiableList(sorted));
        }
    }
}
