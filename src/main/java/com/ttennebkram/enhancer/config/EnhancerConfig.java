package com.ttennebkram.enhancer.config;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Settings for the enhancer core.
 *
 * Defaults come from the classpath resource {@code /enhancer.json}; each key
 * can be overridden by a system property of the same name prefixed with
 * {@code enhancer.} (for example {@code -Denhancer.parallel=false}).
 */
public final class EnhancerConfig {

    private static final Logger LOG = Logger.getLogger(EnhancerConfig.class.getName());

    public static final String RESOURCE = "/enhancer.json";
    public static final String PROPERTY_PREFIX = "enhancer.";

    public static final boolean DEFAULT_PARALLEL = true;
    public static final long DEFAULT_MAX_PIXELS = 200_000_000L;

    /**
     * Upper bound for maxPixels: the samples of a 4-channel image must fit in
     * one Java array.
     */
    public static final long MAX_SUPPORTED_PIXELS = (Integer.MAX_VALUE - 8) / 4;
    public static final double DEFAULT_NOISE_HIGH_THRESHOLD = 0.04;
    public static final boolean DEFAULT_LOG_PARAMETERS = false;

    private final boolean parallel;
    private final long maxPixels;
    private final double noiseHighThreshold;
    private final boolean logParameters;

    private EnhancerConfig(Builder b) {
        if (b.maxPixels <= 0 || b.maxPixels > MAX_SUPPORTED_PIXELS) {
            throw new IllegalArgumentException("maxPixels must be in [1, " + MAX_SUPPORTED_PIXELS + "]: " + b.maxPixels);
        }
        if (!(b.noiseHighThreshold > 0 && b.noiseHighThreshold <= 1)) {
            throw new IllegalArgumentException("noiseHighThreshold must be in (0, 1]: " + b.noiseHighThreshold);
        }
        this.parallel = b.parallel;
        this.maxPixels = b.maxPixels;
        this.noiseHighThreshold = b.noiseHighThreshold;
        this.logParameters = b.logParameters;
    }

    /**
     * Built-in defaults, ignoring the resource and system properties.
     */
    public static EnhancerConfig defaults() {
        return builder().build();
    }

    /**
     * Resource values overridden by system properties.
     */
    public static EnhancerConfig load() {
        Builder builder = builder();
        try (InputStream in = EnhancerConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    applyJson(builder, JsonParser.parseReader(reader).getAsJsonObject());
                }
            } else {
                LOG.fine("No " + RESOURCE + " on the classpath, using defaults");
            }
        } catch (IOException | JsonParseException | IllegalStateException e) {
            LOG.log(Level.WARNING, "Ignoring unreadable " + RESOURCE, e);
        }
        applyProperties(builder, System.getProperties());
        return builder.build();
    }

    static void applyJson(Builder builder, JsonObject json) {
        if (json.has("parallel")) builder.parallel(json.get("parallel").getAsBoolean());
        if (json.has("maxPixels")) builder.maxPixels(json.get("maxPixels").getAsLong());
        if (json.has("noiseHighThreshold")) builder.noiseHighThreshold(json.get("noiseHighThreshold").getAsDouble());
        if (json.has("logParameters")) builder.logParameters(json.get("logParameters").getAsBoolean());
    }

    static void applyProperties(Builder builder, Properties props) {
        String v = props.getProperty(PROPERTY_PREFIX + "parallel");
        if (v != null) builder.parallel(Boolean.parseBoolean(v.trim()));

        v = props.getProperty(PROPERTY_PREFIX + "maxPixels");
        if (v != null) builder.maxPixels(Long.parseLong(v.trim()));

        v = props.getProperty(PROPERTY_PREFIX + "noiseHighThreshold");
        if (v != null) builder.noiseHighThreshold(Double.parseDouble(v.trim()));

        v = props.getProperty(PROPERTY_PREFIX + "logParameters");
        if (v != null) builder.logParameters(Boolean.parseBoolean(v.trim()));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Run row loops on the common fork-join pool. */
    public boolean isParallel() {
        return parallel;
    }

    /** Largest accepted width * height. */
    public long getMaxPixels() {
        return maxPixels;
    }

    /** Noise level at which denoise/sharpen coupling kicks in. */
    public double getNoiseHighThreshold() {
        return noiseHighThreshold;
    }

    /** Log the effective parameter set as JSON at INFO instead of FINE. */
    public boolean isLogParameters() {
        return logParameters;
    }

    public Builder toBuilder() {
        return builder()
                .parallel(parallel)
                .maxPixels(maxPixels)
                .noiseHighThreshold(noiseHighThreshold)
                .logParameters(logParameters);
    }

    @Override
    public String toString() {
        return "EnhancerConfig[parallel=" + parallel + ", maxPixels=" + maxPixels
                + ", noiseHighThreshold=" + noiseHighThreshold + ", logParameters=" + logParameters + "]";
    }

    public static final class Builder {
        private boolean parallel = DEFAULT_PARALLEL;
        private long maxPixels = DEFAULT_MAX_PIXELS;
        private double noiseHighThreshold = DEFAULT_NOISE_HIGH_THRESHOLD;
        private boolean logParameters = DEFAULT_LOG_PARAMETERS;

        private Builder() {
        }

        public Builder parallel(boolean v) { this.parallel = v; return this; }
        public Builder maxPixels(long v) { this.maxPixels = v; return this; }
        public Builder noiseHighThreshold(double v) { this.noiseHighThreshold = v; return this; }
        public Builder logParameters(boolean v) { this.logParameters = v; return this; }

        public EnhancerConfig build() {
            return new EnhancerConfig(this);
        }
    }
}
