package com.ttennebkram.enhancer;

import com.ttennebkram.enhancer.analysis.CharacteristicVector;
import com.ttennebkram.enhancer.model.EncodingAdvice;
import com.ttennebkram.enhancer.model.OutputFormat;

/**
 * Picks encoder settings from the characteristics of the enhanced image.
 *
 * JPEG quality starts at 88. Detailed images get 90 or 92, highly saturated
 * ones two more (at most 95), and smooth low-detail images three less (at
 * least 85). PNG always uses compression level 6.
 */
public class EncodingAdvisor {

    static final int BASE_QUALITY = 88;
    static final int MIN_QUALITY = 85;
    static final int MAX_QUALITY = 95;

    private static final double HIGH_DETAIL_SHARPNESS = 0.06;
    private static final double MEDIUM_DETAIL_SHARPNESS = 0.035;
    private static final double LOW_DETAIL_SHARPNESS = 0.015;
    private static final double HIGH_EDGE_DENSITY = 0.15;
    private static final double LOW_EDGE_DENSITY = 0.05;
    private static final double HIGH_SATURATION = 120.0 / 255.0;

    public EncodingAdvice advise(CharacteristicVector output, OutputFormat format) {
        if (format == OutputFormat.PNG) {
            return new EncodingAdvice(format, 0, EncodingAdvice.PNG_COMPRESSION);
        }
        return new EncodingAdvice(format, jpegQuality(output), -1);
    }

    int jpegQuality(CharacteristicVector v) {
        int quality = BASE_QUALITY;

        if (v.getSharpness() > HIGH_DETAIL_SHARPNESS || v.getEdgeDensity() > HIGH_EDGE_DENSITY) {
            quality = 92;
        } else if (v.getSharpness() > MEDIUM_DETAIL_SHARPNESS) {
            quality = 90;
        }

        if (v.getSaturation() > HIGH_SATURATION) {
            quality = Math.min(quality + 2, MAX_QUALITY);
        }

        if (v.getSharpness() < LOW_DETAIL_SHARPNESS && v.getEdgeDensity() < LOW_EDGE_DENSITY) {
            quality = Math.max(quality - 3, MIN_QUALITY);
        }
        return quality;
    }
}
