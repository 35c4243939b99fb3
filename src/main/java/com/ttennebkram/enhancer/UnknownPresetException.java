package com.ttennebkram.enhancer;

/**
 * The requested preset identifier is not one of the supported presets.
 */
public class UnknownPresetException extends EnhancementException {

    private final String presetId;

    public UnknownPresetException(String presetId) {
        super("Unknown preset: " + presetId);
        this.presetId = presetId;
    }

    public String getPresetId() {
        return presetId;
    }
}
