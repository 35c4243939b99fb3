package com.ttennebkram.enhancer.operations;

/**
 * Declared range and default of one operation parameter.
 */
public final class ParamSpec {

    private final String name;
    private final double min;
    private final double max;
    private final double defaultValue;

    public ParamSpec(String name, double min, double max, double defaultValue) {
        if (!(min <= defaultValue && defaultValue <= max)) {
            throw new IllegalArgumentException("Default of " + name + " outside [" + min + ", " + max + "]");
        }
        this.name = name;
        this.min = min;
        this.max = max;
        this.defaultValue = defaultValue;
    }

    public static ParamSpec of(String name, double min, double max, double defaultValue) {
        return new ParamSpec(name, min, max, defaultValue);
    }

    public String getName() {
        return name;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getDefault() {
        return defaultValue;
    }

    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    @Override
    public String toString() {
        return name + "[" + min + ".." + max + ", default " + defaultValue + "]";
    }
}
