package com.ttennebkram.enhancer.analysis;

import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable per-image statistics computed once by {@link ImageAnalyzer}.
 *
 * Brightness, contrast, noise, saturation, sharpness and all ratios are in
 * [0, 1]. The two color casts are in [-1, 1]. Values are always finite.
 */
public final class CharacteristicVector {

    /** Boundary vector reported for zero-area images. */
    public static final CharacteristicVector EMPTY = builder().build();

    private final double brightness;
    private final double contrast;
    private final double noise;
    private final double saturation;
    private final double sharpness;
    private final double edgeDensity;
    private final double darkRatio;
    private final double brightRatio;
    private final double greenRatio;
    private final double blueRatio;
    private final double warmRatio;
    private final double skinRatio;
    private final double redCast;
    private final double blueCast;

    private CharacteristicVector(Builder b) {
        this.brightness = unit(b.brightness);
        this.contrast = unit(b.contrast);
        this.noise = unit(b.noise);
        this.saturation = unit(b.saturation);
        this.sharpness = unit(b.sharpness);
        this.edgeDensity = unit(b.edgeDensity);
        this.darkRatio = unit(b.darkRatio);
        this.brightRatio = unit(b.brightRatio);
        this.greenRatio = unit(b.greenRatio);
        this.blueRatio = unit(b.blueRatio);
        this.warmRatio = unit(b.warmRatio);
        this.skinRatio = unit(b.skinRatio);
        this.redCast = signedUnit(b.redCast);
        this.blueCast = signedUnit(b.blueCast);
    }

    private static double unit(double v) {
        if (!Double.isFinite(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static double signedUnit(double v) {
        if (!Double.isFinite(v)) return 0.0;
        return Math.max(-1.0, Math.min(1.0, v));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Mean luma, normalized. */
    public double getBrightness() {
        return brightness;
    }

    /** Luma standard deviation / 127.5. */
    public double getContrast() {
        return contrast;
    }

    /** Estimated noise sigma as a fraction of full scale. */
    public double getNoise() {
        return noise;
    }

    /** Mean HSV saturation. */
    public double getSaturation() {
        return saturation;
    }

    /** Mean gradient magnitude of the normalized luma. */
    public double getSharpness() {
        return sharpness;
    }

    public double getEdgeDensity() {
        return edgeDensity;
    }

    public double getDarkRatio() {
        return darkRatio;
    }

    public double getBrightRatio() {
        return brightRatio;
    }

    public double getGreenRatio() {
        return greenRatio;
    }

    public double getBlueRatio() {
        return blueRatio;
    }

    public double getWarmRatio() {
        return warmRatio;
    }

    public double getSkinRatio() {
        return skinRatio;
    }

    /** (mean red - mean luma) / 255. Negative when red is attenuated. */
    public double getRedCast() {
        return redCast;
    }

    /** (mean blue - mean luma) / 255. */
    public double getBlueCast() {
        return blueCast;
    }

    public double get(VectorField field) {
        return field.read(this);
    }

    public Map<VectorField, Double> asMap() {
        Map<VectorField, Double> map = new EnumMap<>(VectorField.class);
        for (VectorField f : VectorField.values()) {
            map.put(f, f.read(this));
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CharacteristicVector)) return false;
        CharacteristicVector other = (CharacteristicVector) o;
        for (VectorField f : VectorField.values()) {
            if (Double.compare(f.read(this), f.read(other)) != 0) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 17;
        for (VectorField f : VectorField.values()) {
            h = 31 * h + Double.hashCode(f.read(this));
        }
        return h;
    }

    @Override
    public String toString() {
        return String.format("CharacteristicVector[brightness=%.3f, contrast=%.3f, noise=%.4f, "
                        + "saturation=%.3f, sharpness=%.4f, skin=%.3f, redCast=%.3f]",
                brightness, contrast, noise, saturation, sharpness, skinRatio, redCast);
    }

    public static final class Builder {
        private double brightness;
        private double contrast;
        private double noise;
        private double saturation;
        private double sharpness;
        private double edgeDensity;
        private double darkRatio;
        private double brightRatio;
        private double greenRatio;
        private double blueRatio;
        private double warmRatio;
        private double skinRatio;
        private double redCast;
        private double blueCast;

        private Builder() {
        }

        public Builder brightness(double v) { this.brightness = v; return this; }
        public Builder contrast(double v) { this.contrast = v; return this; }
        public Builder noise(double v) { this.noise = v; return this; }
        public Builder saturation(double v) { this.saturation = v; return this; }
        public Builder sharpness(double v) { this.sharpness = v; return this; }
        public Builder edgeDensity(double v) { this.edgeDensity = v; return this; }
        public Builder darkRatio(double v) { this.darkRatio = v; return this; }
        public Builder brightRatio(double v) { this.brightRatio = v; return this; }
        public Builder greenRatio(double v) { this.greenRatio = v; return this; }
        public Builder blueRatio(double v) { this.blueRatio = v; return this; }
        public Builder warmRatio(double v) { this.warmRatio = v; return this; }
        public Builder skinRatio(double v) { this.skinRatio = v; return this; }
        public Builder redCast(double v) { this.redCast = v; return this; }
        public Builder blueCast(double v) { this.blueCast = v; return this; }

        public CharacteristicVector build() {
            return new CharacteristicVector(this);
        }
    }
}
