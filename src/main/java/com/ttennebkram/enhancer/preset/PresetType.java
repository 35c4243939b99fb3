package com.ttennebkram.enhancer.preset;

/**
 * The built-in presets. Each id names a JSON file under /presets on the classpath.
 */
public enum PresetType {
    PORTRAIT("portrait"),
    PETS("pets"),
    FOOD("food"),
    LANDSCAPE("landscape"),
    ARCHITECTURE("architecture"),
    CITY("city"),
    OCEAN("ocean"),
    UNDERWATER("underwater"),
    JUNGLE("jungle"),
    SNOW("snow"),
    INDOOR("indoor"),
    STANDARD("standard"),
    SUNSET("sunset"),
    NIGHT("night"),
    BRIGHT("bright"),
    CINEMATIC("cinematic"),
    RETRO("retro"),
    BLACK_AND_WHITE("black_and_white");

    private final String id;

    PresetType(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Look up a preset by id (exact match). Returns null if there is none.
     */
    public static PresetType fromId(String id) {
        for (PresetType type : values()) {
            if (type.id.equals(id)) return type;
        }
        return null;
    }

    @Override
    public String toString() {
        return id;
    }
}
