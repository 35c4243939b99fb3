package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.processing.ColorSpaces;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.List;

/**
 * Adaptive gamma: moves the mean luma towards a target.
 *
 * The exponent p = log(target) / log(mean) maps the current mean onto the
 * target. It is clipped to [0.4, 2.5] and blended towards 1 by strength, so
 * strength 0 is the identity. The curve is applied to R, G and B through one
 * 256-entry LUT and is monotonic for any exponent.
 */
@OperationInfo(opType = "Exposure", category = "Tone",
        description = "Gamma LUT pulling mean luma towards a target")
public class ExposureOperation extends OperationBase {

    static final double MIN_EXPONENT = 0.4;
    static final double MAX_EXPONENT = 2.5;

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("target", 0.2, 0.8, 0.5),
                ParamSpec.of("strength", 0, 1, 0));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx)
            throws OperationFailureException {
        double target = params.get("target");
        double strength = params.get("strength");
        if (strength == 0) {
            return copyOf(input);
        }

        Mat gray = ColorSpaces.luma(input);
        double mean = Core.mean(gray).val[0] / 255.0;
        gray.release();

        double exponent = exponent(mean, target, strength);
        if (!Double.isFinite(exponent)) {
            throw new OperationFailureException(getOpType(), "exponent is " + exponent);
        }

        Mat lut = buildLut(exponent);
        Mat output = new Mat();
        try {
            Core.LUT(input, lut, output);
            return output;
        } finally {
            lut.release();
        }
    }

    /**
     * Gamma exponent applied for a given mean luma (0..1), target and
     * strength. Below 1 brightens, above 1 darkens.
     */
    public static double exponent(double meanLuma, double target, double strength) {
        return 1.0 + strength * (exponentFor(meanLuma, target) - 1.0);
    }

    /**
     * Exponent mapping mean onto target, clipped. Means at the ends of the
     * range, where the logarithm degenerates, are pinned to one 8-bit step
     * inside it.
     */
    static double exponentFor(double mean, double target) {
        double m = Math.max(1.0 / 255.0, Math.min(254.0 / 255.0, mean));
        double p = Math.log(target) / Math.log(m);
        return Math.max(MIN_EXPONENT, Math.min(MAX_EXPONENT, p));
    }

    static Mat buildLut(double exponent) {
        Mat lut = new Mat(1, 256, CvType.CV_8U);
        byte[] table = new byte[256];
        for (int i = 0; i < 256; i++) {
            double v = 255.0 * Math.pow(i / 255.0, exponent);
            table[i] = (byte) (int) Math.round(Math.max(0, Math.min(255, v)));
        }
        lut.put(0, 0, table);
        return lut;
    }
}
