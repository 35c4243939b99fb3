package com.ttennebkram.enhancer.adaptation;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.operations.ParameterValues;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The concrete, clamped schedule for one invocation: operation types with
 * their final parameter values, in execution order.
 */
public final class EffectiveParameterSet {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /**
     * One scheduled operation.
     */
    public static final class Entry {
        private final String opType;
        private final ParameterValues values;

        public Entry(String opType, ParameterValues values) {
            this.opType = opType;
            this.values = values;
        }

        public String getOpType() {
            return opType;
        }

        public ParameterValues getValues() {
            return values;
        }

        @Override
        public String toString() {
            return opType + values;
        }
    }

    private final String presetId;
    private final List<Entry> entries;

    public EffectiveParameterSet(String presetId, List<Entry> entries) {
        this.presetId = presetId;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public String getPresetId() {
        return presetId;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Values of the first entry with this op type, or null.
     */
    public ParameterValues valuesFor(String opType) {
        for (Entry e : entries) {
            if (e.opType.equals(opType)) return e.values;
        }
        return null;
    }

    /**
     * Values of every entry with this op type, in order.
     */
    public List<ParameterValues> allValuesFor(String opType) {
        List<ParameterValues> result = new ArrayList<>();
        for (Entry e : entries) {
            if (e.opType.equals(opType)) result.add(e.values);
        }
        return result;
    }

    public JsonObject toJsonObject() {
        JsonObject root = new JsonObject();
        root.addProperty("preset", presetId);
        JsonArray steps = new JsonArray();
        for (Entry e : entries) {
            JsonObject step = new JsonObject();
            step.addProperty("op", e.opType);
            step.add("params", e.values.toJson());
            steps.add(step);
        }
        root.add("steps", steps);
        return root;
    }

    /**
     * Pretty-printed JSON, for diagnostics.
     */
    public String toJson() {
        return GSON.toJson(toJsonObject());
    }

    @Override
    public String toString() {
        return "EffectiveParameterSet[" + presetId + ", " + entries + "]";
    }
}
