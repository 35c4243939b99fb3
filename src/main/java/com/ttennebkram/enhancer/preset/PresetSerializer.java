package com.ttennebkram.enhancer.preset;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.enhancer.analysis.VectorField;
import com.ttennebkram.enhancer.operations.ParameterValues;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes preset documents.
 *
 * Format:
 * <pre>
 * {
 *   "id": "night",
 *   "description": "...",
 *   "steps": [
 *     { "op": "Denoise",
 *       "params": { "strength": 5 },
 *       "rules": [
 *         { "param": "strength", "input": "brightness", "mode": "ADD",
 *           "from": 0.5, "to": 0.0, "amount": 10, "cap": 15 }
 *       ] }
 *   ]
 * }
 * </pre>
 * "from" and "to" are omitted for TRACK rules; "floor" and "cap" are optional.
 */
public class PresetSerializer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /**
     * Parse a preset document.
     *
     * @throws IllegalArgumentException if the document is malformed
     */
    public static PresetDefinition load(Reader reader) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Not a JSON document: " + e.getMessage(), e);
        }
        return fromJson(asObject(root, "preset document"));
    }

    /**
     * Build a preset from its JSON form.
     *
     * @throws IllegalArgumentException if a field is missing or has the wrong JSON type;
     *         the message names the preset and, where known, the step
     */
    public static PresetDefinition fromJson(JsonObject root) {
        String id = requireString(root, "id");
        String description;
        JsonArray stepsJson;
        try {
            description = root.has("description") ? asString(root.get("description"), "description") : "";
            stepsJson = optionalArray(root, "steps");
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(id + ": " + e.getMessage(), e);
        }

        List<OperationStep> steps = new ArrayList<>();
        for (int i = 0; i < stepsJson.size(); i++) {
            steps.add(stepFromJson(stepsJson.get(i), id, i));
        }
        return new PresetDefinition(id, description, steps);
    }

    private static OperationStep stepFromJson(JsonElement elem, String presetId, int index) {
        JsonObject stepJson;
        String opType;
        try {
            stepJson = asObject(elem, "step");
            opType = requireString(stepJson, "op");
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(presetId + "/step " + index + ": " + e.getMessage(), e);
        }
        try {
            Map<String, Double> params = new LinkedHashMap<>();
            if (stepJson.has("params")) {
                for (Map.Entry<String, JsonElement> e : asObject(stepJson.get("params"), "params").entrySet()) {
                    params.put(e.getKey(), asNumber(e.getValue(), "param " + e.getKey()));
                }
            }

            List<AdaptationRule> rules = new ArrayList<>();
            JsonArray rulesJson = optionalArray(stepJson, "rules");
            for (int i = 0; i < rulesJson.size(); i++) {
                rules.add(ruleFromJson(asObject(rulesJson.get(i), "rule " + i)));
            }
            return new OperationStep(opType, ParameterValues.of(params), rules);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(presetId + "/" + opType + ": " + e.getMessage(), e);
        }
    }

    private static AdaptationRule ruleFromJson(JsonObject ruleJson) {
        String param = requireString(ruleJson, "param");
        VectorField input = VectorField.fromKey(requireString(ruleJson, "input"));
        RuleMode mode = RuleMode.fromString(requireString(ruleJson, "mode"));
        if (mode.usesRamp() && !(ruleJson.has("from") && ruleJson.has("to"))) {
            throw new IllegalArgumentException("Rule for " + param + " needs from and to");
        }
        if (!ruleJson.has("amount")) {
            throw new IllegalArgumentException("Rule for " + param + " needs an amount");
        }
        double from = ruleJson.has("from") ? asNumber(ruleJson.get("from"), "from") : 0.0;
        double to = ruleJson.has("to") ? asNumber(ruleJson.get("to"), "to") : 0.0;
        double amount = asNumber(ruleJson.get("amount"), "amount");
        Double floor = ruleJson.has("floor") ? asNumber(ruleJson.get("floor"), "floor") : null;
        Double cap = ruleJson.has("cap") ? asNumber(ruleJson.get("cap"), "cap") : null;
        return new AdaptationRule(param, input, mode, from, to, amount, floor, cap);
    }

    /**
     * Save a preset document.
     */
    public static void save(PresetDefinition preset, Writer writer) throws IOException {
        GSON.toJson(toJson(preset), writer);
        writer.flush();
    }

    public static JsonObject toJson(PresetDefinition preset) {
        JsonObject root = new JsonObject();
        root.addProperty("id", preset.getId());
        root.addProperty("description", preset.getDescription());

        JsonArray stepsArray = new JsonArray();
        for (OperationStep step : preset.getSteps()) {
            JsonObject stepJson = new JsonObject();
            stepJson.addProperty("op", step.getOpType());
            if (step.getBase().size() > 0) {
                stepJson.add("params", step.getBase().toJson());
            }
            if (!step.getRules().isEmpty()) {
                JsonArray rulesArray = new JsonArray();
                for (AdaptationRule rule : step.getRules()) {
                    rulesArray.add(ruleToJson(rule));
                }
                stepJson.add("rules", rulesArray);
            }
            stepsArray.add(stepJson);
        }
        root.add("steps", stepsArray);
        return root;
    }

    private static JsonObject ruleToJson(AdaptationRule rule) {
        JsonObject json = new JsonObject();
        json.addProperty("param", rule.getParam());
        json.addProperty("input", rule.getInput().getKey());
        json.addProperty("mode", rule.getMode().name());
        if (rule.getMode().usesRamp()) {
            json.addProperty("from", rule.getFrom());
            json.addProperty("to", rule.getTo());
        }
        json.addProperty("amount", rule.getAmount());
        if (rule.getFloor() != null) json.addProperty("floor", rule.getFloor());
        if (rule.getCap() != null) json.addProperty("cap", rule.getCap());
        return json;
    }

    private static String requireString(JsonObject json, String key) {
        if (!json.has(key) || json.get(key).isJsonNull()) {
            throw new IllegalArgumentException("Missing \"" + key + "\"");
        }
        return asString(json.get(key), key);
    }

    private static String asString(JsonElement elem, String what) {
        if (!elem.isJsonPrimitive() || !elem.getAsJsonPrimitive().isString()) {
            throw new IllegalArgumentException(what + " must be a string, got " + elem);
        }
        return elem.getAsString();
    }

    private static double asNumber(JsonElement elem, String what) {
        if (!elem.isJsonPrimitive() || !elem.getAsJsonPrimitive().isNumber()) {
            throw new IllegalArgumentException(what + " must be a number, got " + elem);
        }
        return elem.getAsDouble();
    }

    private static JsonObject asObject(JsonElement elem, String what) {
        if (!elem.isJsonObject()) {
            throw new IllegalArgumentException(what + " must be a JSON object, got " + elem);
        }
        return elem.getAsJsonObject();
    }

    private static JsonArray optionalArray(JsonObject json, String key) {
        if (!json.has(key)) {
            return new JsonArray();
        }
        JsonElement elem = json.get(key);
        if (!elem.isJsonArray()) {
            throw new IllegalArgumentException("\"" + key + "\" must be an array, got " + elem);
        }
        return elem.getAsJsonArray();
    }
}
