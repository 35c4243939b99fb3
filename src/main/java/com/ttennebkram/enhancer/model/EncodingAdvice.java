package com.ttennebkram.enhancer.model;

/**
 * Settings suggested to the external encoder for the enhanced image.
 */
public final class EncodingAdvice {

    /** PNG compression level used for every PNG delivery. */
    public static final int PNG_COMPRESSION = 6;

    private final OutputFormat format;
    private final int jpegQuality;
    private final int pngCompression;

    public EncodingAdvice(OutputFormat format, int jpegQuality, int pngCompression) {
        this.format = format;
        this.jpegQuality = jpegQuality;
        this.pngCompression = pngCompression;
    }

    public OutputFormat getFormat() {
        return format;
    }

    /**
     * JPEG quality 85..95, or 0 when the format is not JPG.
     */
    public int getJpegQuality() {
        return jpegQuality;
    }

    /**
     * PNG compression level, or -1 when the format is not PNG.
     */
    public int getPngCompression() {
        return pngCompression;
    }

    @Override
    public String toString() {
        if (format == OutputFormat.PNG) {
            return "EncodingAdvice[png, compression=" + pngCompression + "]";
        }
        return "EncodingAdvice[jpg, quality=" + jpegQuality + "]";
    }
}
