package com.neurasense.jitai.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Two-level mapping from namespace to named tailoring variables, rebuilt for every decision.
 * <p>
 * Namespaces and variables keep insertion order and the whole structure is unmodifiable,
 * so two contexts built from the same inputs serialize identically. Null values are never
 * stored: an absent variable and a null one resolve the same way.
 */
public final class TailoringContext {

    public static final String CHECKIN = "checkin";
    public static final String TIME = "time";
    public static final String TREND = "trend";
    public static final String ENGAGEMENT = "engagement";

    private final Map<String, Map<String, Object>> namespaces;

    private TailoringContext(Map<String, Map<String, Object>> namespaces) {
        this.namespaces = namespaces;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a context from plain nested maps, mostly for tests and previews.
     */
    public static TailoringContext of(Map<String, ? extends Map<String, ?>> values) {
        Builder builder = builder();
        values.forEach((ns, vars) -> vars.forEach((name, value) -> builder.put(ns, name, value)));
        return builder.build();
    }

    /**
     * Walks a dotted path such as {@code checkin.mood}.
     *
     * @param path the dotted path
     * @return the value, or null when any segment is absent
     */
    public Object resolve(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        return resolve(path.split("\\."));
    }

    public Object resolve(String[] segments) {
        Object current = namespaces;
        for (String segment : segments) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    public Map<String, Object> namespace(String name) {
        Map<String, Object> ns = namespaces.get(name);
        return ns != null ? ns : Map.of();
    }

    @JsonValue
    public Map<String, Map<String, Object>> asMap() {
        return namespaces;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return namespaces.equals(((TailoringContext) o).namespaces);
    }

    @Override
    public int hashCode() {
        return namespaces.hashCode();
    }

    @Override
    public String toString() {
        return namespaces.toString();
    }

    public static final class Builder {

        private final Map<String, Map<String, Object>> namespaces = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String namespace, String name, Object value) {
            Map<String, Object> ns = namespaces.computeIfAbsent(namespace, k -> new LinkedHashMap<>());
            if (value != null) {
                ns.put(name, value);
            }
            return this;
        }

        public Builder putAll(String namespace, Map<String, ?> values) {
            namespaces.computeIfAbsent(namespace, k -> new LinkedHashMap<>());
            values.forEach((name, value) -> put(namespace, name, value));
            return this;
        }

        public TailoringContext build() {
            Map<String, Map<String, Object>> frozen = new LinkedHashMap<>();
            namespaces.forEach((ns, vars) ->
                    frozen.put(ns, Collections.unmodifiableMap(new LinkedHashMap<>(vars))));
            return new TailoringContext(Collections.unmodifiableMap(frozen));
        }
    }
}
