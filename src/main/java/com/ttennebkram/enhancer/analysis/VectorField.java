package com.ttennebkram.enhancer.analysis;

/**
 * Names of the characteristic vector components, as referenced by
 * adaptation rules in preset files.
 */
public enum VectorField {
    BRIGHTNESS("brightness"),
    CONTRAST("contrast"),
    NOISE("noise"),
    SATURATION("saturation"),
    SHARPNESS("sharpness"),
    EDGE_DENSITY("edgeDensity"),
    DARK_RATIO("darkRatio"),
    BRIGHT_RATIO("brightRatio"),
    GREEN_RATIO("greenRatio"),
    BLUE_RATIO("blueRatio"),
    WARM_RATIO("warmRatio"),
    SKIN_RATIO("skinRatio"),
    RED_CAST("redCast"),
    BLUE_CAST("blueCast");

    private final String key;

    VectorField(String key) {
        this.key = key;
    }

    /**
     * Name used for this field in preset files.
     */
    public String getKey() {
        return key;
    }

    /**
     * Look up a field by its preset-file name.
     *
     * @throws IllegalArgumentException if no field has that name
     */
    public static VectorField fromKey(String key) {
        for (VectorField f : values()) {
            if (f.key.equals(key)) return f;
        }
        throw new IllegalArgumentException("Unknown characteristic: " + key);
    }

    public double read(CharacteristicVector v) {
        switch (this) {
            case BRIGHTNESS: return v.getBrightness();
            case CONTRAST: return v.getContrast();
            case NOISE: return v.getNoise();
            case SATURATION: return v.getSaturation();
            case SHARPNESS: return v.getSharpness();
            case EDGE_DENSITY: return v.getEdgeDensity();
            case DARK_RATIO: return v.getDarkRatio();
            case BRIGHT_RATIO: return v.getBrightRatio();
            case GREEN_RATIO: return v.getGreenRatio();
            case BLUE_RATIO: return v.getBlueRatio();
            case WARM_RATIO: return v.getWarmRatio();
            case SKIN_RATIO: return v.getSkinRatio();
            case RED_CAST: return v.getRedCast();
            case BLUE_CAST: return v.getBlueCast();
            default: throw new IllegalStateException("Unhandled field " + this);
        }
    }
}
