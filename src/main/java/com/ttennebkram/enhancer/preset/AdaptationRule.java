package com.ttennebkram.enhancer.preset;

import com.ttennebkram.enhancer.analysis.CharacteristicVector;
import com.ttennebkram.enhancer.analysis.VectorField;

/**
 * One image-dependent adjustment of a single operation parameter.
 *
 * The ramp is 0 at {@code from}, 1 at {@code to} and linear in between,
 * clamped outside. A {@code from} above {@code to} gives a falling input
 * ("the darker the image, the more"). Optional floor and cap bound the value
 * right after the rule has been applied.
 */
public final class AdaptationRule {

    private final String param;
    private final VectorField input;
    private final RuleMode mode;
    private final double from;
    private final double to;
    private final double amount;
    private final Double floor;
    private final Double cap;

    public AdaptationRule(String param, VectorField input, RuleMode mode,
                          double from, double to, double amount, Double floor, Double cap) {
        if (param == null || input == null || mode == null) {
            throw new IllegalArgumentException("Rule needs param, input and mode");
        }
        if (!Double.isFinite(amount) || !Double.isFinite(from) || !Double.isFinite(to)) {
            throw new IllegalArgumentException("Rule for " + param + " has a non-finite constant");
        }
        if (mode.usesRamp() && from == to) {
            throw new IllegalArgumentException("Rule for " + param + " has an empty ramp (from == to == " + from + ")");
        }
        if (floor != null && cap != null && floor > cap) {
            throw new IllegalArgumentException("Rule for " + param + " has floor " + floor + " above cap " + cap);
        }
        this.param = param;
        this.input = input;
        this.mode = mode;
        this.from = from;
        this.to = to;
        this.amount = amount;
        this.floor = floor;
        this.cap = cap;
    }

    public static AdaptationRule ramp(String param, VectorField input, RuleMode mode,
                                      double from, double to, double amount) {
        return new AdaptationRule(param, input, mode, from, to, amount, null, null);
    }

    public static AdaptationRule track(String param, VectorField input, double amount) {
        return new AdaptationRule(param, input, RuleMode.TRACK, 0, 0, amount, null, null);
    }

    /**
     * Apply this rule to the current value of its parameter.
     */
    public double apply(double value, CharacteristicVector vector) {
        double x = vector.get(input);
        double result;
        switch (mode) {
            case ADD:
                result = value + amount * ramp(x);
                break;
            case SCALE:
                result = value * (1.0 + amount * ramp(x));
                break;
            case TRACK:
                result = value + amount * x;
                break;
            default:
                throw new IllegalStateException("Unhandled mode " + mode);
        }
        if (floor != null) result = Math.max(floor, result);
        if (cap != null) result = Math.min(cap, result);
        return result;
    }

    double ramp(double x) {
        double t = (x - from) / (to - from);
        return Math.max(0.0, Math.min(1.0, t));
    }

    public String getParam() {
        return param;
    }

    public VectorField getInput() {
        return input;
    }

    public RuleMode getMode() {
        return mode;
    }

    public double getFrom() {
        return from;
    }

    public double getTo() {
        return to;
    }

    public double getAmount() {
        return amount;
    }

    /** Lower bound after the rule, or null. */
    public Double getFloor() {
        return floor;
    }

    /** Upper bound after the rule, or null. */
    public Double getCap() {
        return cap;
    }

    @Override
    public String toString() {
        String range = mode.usesRamp() ? " " + from + "->" + to : "";
        return param + " " + mode + " " + amount + " on " + input.getKey() + range;
    }
}
