package com.ttennebkram.enhancer.operations;

import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable named parameter values for one operation step.
 * Insertion order is kept so diagnostics list parameters in schema order.
 */
public final class ParameterValues {

    public static final ParameterValues EMPTY = new ParameterValues(Collections.emptyMap());

    private final Map<String, Double> values;

    private ParameterValues(Map<String, Double> values) {
        this.values = values;
    }

    public static ParameterValues of(Map<String, Double> values) {
        return new ParameterValues(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * Shortcut for tests and ad hoc use: alternating names and values.
     */
    public static ParameterValues of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs");
        }
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            map.put((String) namesAndValues[i], ((Number) namesAndValues[i + 1]).doubleValue());
        }
        return of(map);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException if the parameter is not present
     */
    public double get(String name) {
        Double v = values.get(name);
        if (v == null) {
            throw new IllegalArgumentException("Missing parameter: " + name);
        }
        return v;
    }

    public double get(String name, double defaultValue) {
        Double v = values.get(name);
        return v != null ? v : defaultValue;
    }

    public ParameterValues with(String name, double value) {
        Map<String, Double> map = new LinkedHashMap<>(values);
        map.put(name, value);
        return of(map);
    }

    public Map<String, Double> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        for (Map.Entry<String, Double> e : values.entrySet()) {
            json.addProperty(e.getKey(), e.getValue());
        }
        return json;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterValues)) return false;
        return values.equals(((ParameterValues) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
