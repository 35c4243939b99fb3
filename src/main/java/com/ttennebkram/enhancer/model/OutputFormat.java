package com.ttennebkram.enhancer.model;

import java.util.Locale;

/**
 * Delivery format the external encoder will produce. The enhancer only uses
 * it to decide whether alpha and 16-bit depth survive.
 */
public enum OutputFormat {
    JPG("jpg", false, false),
    PNG("png", true, true);

    private final String extension;
    private final boolean keepsAlpha;
    private final boolean keepsHighBitDepth;

    OutputFormat(String extension, boolean keepsAlpha, boolean keepsHighBitDepth) {
        this.extension = extension;
        this.keepsAlpha = keepsAlpha;
        this.keepsHighBitDepth = keepsHighBitDepth;
    }

    public String getExtension() {
        return extension;
    }

    public boolean keepsAlpha() {
        return keepsAlpha;
    }

    public boolean keepsHighBitDepth() {
        return keepsHighBitDepth;
    }

    /**
     * Parse "jpg", "jpeg" or "png" (any case). Unknown values fall back to JPG,
     * the default delivery format.
     */
    public static OutputFormat fromString(String value) {
        if (value == null) return JPG;
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("png")) return PNG;
        return JPG;
    }
}
