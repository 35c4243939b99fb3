package com.ttennebkram.enhancer.preset;

/**
 * How an {@link AdaptationRule} combines with the parameter value.
 */
public enum RuleMode {
    /** value += amount * ramp */
    ADD,
    /** value *= 1 + amount * ramp */
    SCALE,
    /** value += amount * input, no ramp */
    TRACK;

    public boolean usesRamp() {
        return this != TRACK;
    }

    public static RuleMode fromString(String s) {
        for (RuleMode mode : values()) {
            if (mode.name().equalsIgnoreCase(s)) return mode;
        }
        throw new IllegalArgumentException("Unknown rule mode: " + s);
    }
}
