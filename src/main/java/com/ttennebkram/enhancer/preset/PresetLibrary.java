package com.ttennebkram.enhancer.preset;

import com.ttennebkram.enhancer.UnknownPresetException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * The built-in presets, loaded once from {@code /presets/<id>.json} on the
 * classpath and validated with {@link PresetValidator}.
 *
 * Usage:
 *   PresetDefinition night = PresetLibrary.get("night");
 */
public class PresetLibrary {

    private static final Logger LOG = Logger.getLogger(PresetLibrary.class.getName());

    private static final String RESOURCE_DIR = "/presets/";

    // Map from preset id to definition, in PresetType order
    private static final Map<String, PresetDefinition> presets = new LinkedHashMap<>();

    // Initialization flag
    private static boolean initialized = false;

    /**
     * Load and validate every built-in preset.
     * Safe to call multiple times - only initializes once.
     *
     * @throws IllegalStateException if a preset file is missing or invalid
     */
    public static synchronized void initialize() {
        if (initialized) return;

        Map<PresetType, PresetDefinition> loaded = new EnumMap<>(PresetType.class);
        for (PresetType type : PresetType.values()) {
            PresetDefinition preset = loadResource(type.getId());
            if (!preset.getId().equals(type.getId())) {
                throw new IllegalStateException("Preset file " + type.getId() + ".json declares id " + preset.getId());
            }
            PresetValidator.validate(preset);
            loaded.put(type, preset);
        }
        for (Map.Entry<PresetType, PresetDefinition> e : loaded.entrySet()) {
            presets.put(e.getKey().getId(), e.getValue());
        }

        LOG.fine("Loaded " + presets.size() + " presets");
        initialized = true;
    }

    private static PresetDefinition loadResource(String id) {
        String path = RESOURCE_DIR + id + ".json";
        InputStream in = PresetLibrary.class.getResourceAsStream(path);
        if (in == null) {
            throw new IllegalStateException("Missing preset resource " + path);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return PresetSerializer.load(reader);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read preset resource " + path, e);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Malformed preset resource " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * @throws UnknownPresetException if no preset has this id
     */
    public static PresetDefinition get(String id) throws UnknownPresetException {
        initialize();
        PresetDefinition preset = id != null ? presets.get(id) : null;
        if (preset == null) {
            throw new UnknownPresetException(id);
        }
        return preset;
    }

    public static PresetDefinition get(PresetType type) {
        initialize();
        return presets.get(type.getId());
    }

    public static boolean hasPreset(String id) {
        initialize();
        return presets.containsKey(id);
    }

    /**
     * All preset ids in declaration order.
     */
    public static Set<String> getIds() {
        initialize();
        return Collections.unmodifiableSet(presets.keySet());
    }
}
